package com.atrium.access.spi;

import java.util.Optional;

/** Read access to stored users. */
public interface UserDirectory {

    Optional<UserAccount> findById(long userId);

    /**
     * @param email normalized email (trimmed, lower-case)
     */
    Optional<UserAccount> findByEmail(String email);
}
