package com.example.chathub.model;

/**
 * Successful group access check: the bearer's stable identity within the group.
 */
public class IdentityGrant {
    private final String user;
    private final String groupName;

    public IdentityGrant(String user, String groupName) {
        this.user = user;
        this.groupName = groupName;
    }

    public String getUser() { return user; }

    /** Display name of the group, when the identity service reports one. */
    public String getGroupName() { return groupName; }
}
