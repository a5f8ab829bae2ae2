package com.warden.database;

import com.warden.security.CredentialStoreException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;

/** Maps Spring's {@link DataAccessException} hierarchy onto {@link CredentialStoreException}. */
final class StorageFailures {

    private StorageFailures() {
        // utility class
    }

    static <T> T translate(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new CredentialStoreException("Credential storage failed during " + operation, e);
        }
    }
}
