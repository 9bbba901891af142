package com.example.chathub.identity;

import com.example.chathub.exception.AuthorizationDeniedException;
import com.example.chathub.exception.UpstreamUnavailableException;
import com.example.chathub.model.IdentityGrant;

/**
 * Group membership check against the identity service.
 */
public interface IdentityClient {

    /**
     * @throws AuthorizationDeniedException  bearer is not a member, or the credential was rejected
     * @throws UpstreamUnavailableException  the service could not be reached
     */
    IdentityGrant verifyGroupAccess(String credential, long groupId);
}
