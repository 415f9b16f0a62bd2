package org.iceforge.warden.server.auth;

import java.util.Optional;

public interface UserAccountStore {

    /** @throws org.iceforge.warden.permission.AuthorizationStoreException when the store cannot be reached */
    Optional<UserAccount> find(String userId);
}
