package com.atrium.portfolio.infrastructure.store;

import com.atrium.access.spi.ResourceMetaSource;
import com.atrium.access.spi.UnitOfWork;
import com.atrium.access.spi.UserAccount;
import com.atrium.access.spi.UserDirectory;
import com.atrium.audit.AuditEntry;
import com.atrium.audit.AuditStore;
import com.atrium.audit.EntityRef;
import com.atrium.portfolio.domain.Organization;
import com.atrium.portfolio.domain.Project;
import com.atrium.portfolio.domain.Tag;
import com.atrium.security.ResourceMeta;
import com.atrium.security.Role;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Transactional in-memory storage for the portfolio service.
 *
 * <p>A unit of work holds the write lock for its whole duration and works on the live tables
 * after taking a snapshot; if the work throws, the snapshot is put back. Nested units of work
 * join the outer one. Reads outside a unit of work take the read lock.
 */
@Repository
public class InMemoryPortfolioStore
        implements UserDirectory, ResourceMetaSource, UnitOfWork, AuditStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPortfolioStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private Tables tables = new Tables();

    public InMemoryPortfolioStore(Clock clock) {
        this.clock = clock;
    }

    // ---- Unit of work ----

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (lock.isWriteLockedByCurrentThread()) {
            return work.get();
        }
        lock.writeLock().lock();
        Tables snapshot = tables.copy();
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            tables = snapshot;
            log.debug("Unit of work rolled back: {}", e.getClass().getSimpleName());
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- Organizations ----

    public Organization createOrganization(String name) {
        return inTransaction(() -> {
            var org = new Organization(tables.nextOrganizationId++, name, clock.instant());
            tables.organizations.put(org.id(), org);
            return org;
        });
    }

    public Optional<Organization> findOrganization(long id) {
        return read(() -> Optional.ofNullable(tables.organizations.get(id)));
    }

    public Optional<Organization> findOrganizationByName(String name) {
        return read(() -> tables.organizations.values().stream()
                .filter(o -> o.name().equals(name))
                .findFirst());
    }

    // ---- Users ----

    public UserAccount createUser(long tenantId, String email, Role role, String passwordHash) {
        return inTransaction(() -> {
            var user = new UserAccount(tables.nextUserId++, tenantId, email, role, passwordHash);
            tables.users.put(user.id(), user);
            return user;
        });
    }

    @Override
    public Optional<UserAccount> findById(long userId) {
        return read(() -> Optional.ofNullable(tables.users.get(userId)));
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        return read(() -> tables.users.values().stream()
                .filter(u -> u.email().equals(email))
                .findFirst());
    }

    /** Users of one tenant, ordered by id. */
    public List<UserAccount> listUsers(long tenantId) {
        return read(() -> tables.users.values().stream()
                .filter(u -> u.tenantId() == tenantId)
                .sorted(Comparator.comparingLong(UserAccount::id))
                .toList());
    }

    // ---- Tags ----

    public Tag createTag(long tenantId, String name) {
        return inTransaction(() -> {
            var tag = new Tag(tables.nextTagId++, tenantId, name);
            tables.tags.put(tag.id(), tag);
            return tag;
        });
    }

    public Optional<Tag> findTag(long tenantId, String name) {
        return read(() -> tables.tags.values().stream()
                .filter(t -> t.tenantId() == tenantId && t.name().equals(name))
                .findFirst());
    }

    public List<Tag> findTags(Collection<Long> ids) {
        return read(() -> ids.stream()
                .map(tables.tags::get)
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(Tag::name))
                .toList());
    }

    /** Tags of one tenant, ordered by name. */
    public List<Tag> listTags(long tenantId) {
        return read(() -> tables.tags.values().stream()
                .filter(t -> t.tenantId() == tenantId)
                .sorted(Comparator.comparing(Tag::name))
                .toList());
    }

    // ---- Projects ----

    public Project createProject(
            long tenantId,
            long ownerUserId,
            String title,
            String description,
            String githubUrl,
            boolean isPublic,
            List<Long> tagIds) {
        return inTransaction(() -> {
            var now = clock.instant();
            var project = new Project(tables.nextProjectId++, tenantId, ownerUserId, title,
                    description, githubUrl, isPublic, tagIds, now, now);
            tables.projects.put(project.id(), project);
            return project;
        });
    }

    /** Replaces a stored project; tenant, owner and creation time are kept from the stored copy. */
    public Project updateProject(Project changed) {
        return inTransaction(() -> {
            Project existing = tables.projects.get(changed.id());
            if (existing == null) {
                throw new IllegalStateException("project " + changed.id() + " does not exist");
            }
            var updated = new Project(existing.id(), existing.tenantId(), existing.ownerUserId(),
                    changed.title(), changed.description(), changed.githubUrl(), changed.isPublic(),
                    changed.tagIds(), existing.createdAt(), clock.instant());
            tables.projects.put(updated.id(), updated);
            return updated;
        });
    }

    public void deleteProject(long id) {
        inTransaction(() -> tables.projects.remove(id));
    }

    public Optional<Project> findProject(long id) {
        return read(() -> Optional.ofNullable(tables.projects.get(id)));
    }

    public List<Project> listProjects(long tenantId) {
        return read(() -> tables.projects.values().stream()
                .filter(p -> p.tenantId() == tenantId)
                .toList());
    }

    // ---- Resource metadata ----

    @Override
    public Optional<ResourceMeta> load(EntityRef entity, long tenantId) {
        return read(() -> switch (entity.kind()) {
            case PROJECT -> Optional.ofNullable(tables.projects.get(entity.id())).map(Project::meta);
            case TAG -> Optional.ofNullable(tables.tags.get(entity.id()))
                    .map(t -> ResourceMeta.unowned(t.tenantId()));
            case USER -> Optional.ofNullable(tables.users.get(entity.id()))
                    .map(u -> ResourceMeta.unowned(u.tenantId()));
            case ORGANIZATION -> Optional.ofNullable(tables.organizations.get(entity.id()))
                    .map(o -> ResourceMeta.unowned(o.id()));
        });
    }

    // ---- Audit ----

    @Override
    public void append(AuditEntry entry) {
        inTransaction(() -> tables.audit.add(entry));
    }

    /** Newest first: entries are returned in reverse order of appending. */
    @Override
    public List<AuditEntry> findByTenant(long tenantId, int limit, int offset) {
        return read(() -> {
            List<AuditEntry> result = new ArrayList<>();
            int skipped = 0;
            for (int i = tables.audit.size() - 1; i >= 0 && result.size() < limit; i--) {
                AuditEntry entry = tables.audit.get(i);
                if (entry.tenantId() != tenantId) {
                    continue;
                }
                if (skipped++ < offset) {
                    continue;
                }
                result.add(entry);
            }
            return result;
        });
    }

    private static final class Tables {
        final Map<Long, Organization> organizations = new LinkedHashMap<>();
        final Map<Long, UserAccount> users = new LinkedHashMap<>();
        final Map<Long, Tag> tags = new LinkedHashMap<>();
        final Map<Long, Project> projects = new LinkedHashMap<>();
        final List<AuditEntry> audit = new ArrayList<>();
        long nextOrganizationId = 1;
        long nextUserId = 1;
        long nextTagId = 1;
        long nextProjectId = 1;

        Tables copy() {
            var copy = new Tables();
            copy.organizations.putAll(organizations);
            copy.users.putAll(users);
            copy.tags.putAll(tags);
            copy.projects.putAll(projects);
            copy.audit.addAll(audit);
            copy.nextOrganizationId = nextOrganizationId;
            copy.nextUserId = nextUserId;
            copy.nextTagId = nextTagId;
            copy.nextProjectId = nextProjectId;
            return copy;
        }
    }
}
