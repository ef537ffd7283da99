package com.mlorenc.project.board.model;

import com.mlorenc.project.board.exception.ValidationException;

/**
 * External identity of a project board. An owner containing {@code /} addresses a user
 * project (the login is the part before the slash), {@code @me} the authenticated viewer,
 * anything else an organization.
 */
public record ProjectRef(String owner, int number) {

    private static final String VIEWER_OWNER = "@me";

    public ProjectRef {
        if (owner == null || owner.isBlank()) {
            throw new ValidationException("Project owner is required");
        }
        if (number <= 0) {
            throw new ValidationException("Project number must be positive, got %d", number);
        }
        owner = owner.strip();
    }

    public OwnerKind ownerKind() {
        if (VIEWER_OWNER.equals(owner)) {
            return OwnerKind.VIEWER;
        }
        return owner.contains("/") ? OwnerKind.USER : OwnerKind.ORGANIZATION;
    }

    public String login() {
        int slash = owner.indexOf('/');
        return slash >= 0 ? owner.substring(0, slash) : owner;
    }

    public enum OwnerKind {
        ORGANIZATION("organization"),
        USER("user"),
        VIEWER("viewer");

        private final String rootField;

        OwnerKind(String rootField) {
            this.rootField = rootField;
        }

        public String rootField() {
            return rootField;
        }
    }
}
