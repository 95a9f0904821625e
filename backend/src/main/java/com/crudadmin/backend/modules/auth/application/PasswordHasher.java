package com.crudadmin.backend.modules.auth.application;

/**
 * One-way salted password hashing.
 */
public interface PasswordHasher {

    /**
     * @return a freshly salted hash of {@code plaintext}
     * @throws HashingException if the hash could not be produced
     */
    String hash(String plaintext);

    /**
     * Never throws. A mismatch and an unreadable hash both yield {@code false}.
     */
    boolean verify(String plaintext, String hash);

    /**
     * Hash of an unguessable secret, produced with the same cost as {@link #hash(String)}.
     * Verified against when the account does not exist so both login failure paths do equal work.
     */
    String dummyHash();
}
