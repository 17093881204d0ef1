package com.adlab.backend.global.error;

import java.util.Objects;

public class GovernanceException extends ProblemException implements GovernanceFailure {

    private final GovernanceErrorKind kind;
    private final GovernanceStage stage;

    public GovernanceException(GovernanceErrorKind kind, GovernanceStage stage, String detail) {
        this(kind, stage, detail, null);
    }

    public GovernanceException(GovernanceErrorKind kind, GovernanceStage stage, String detail, Throwable cause) {
        super(Objects.requireNonNull(kind, "kind").status(), kind.code(), detail, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public static GovernanceException notAuthenticated() {
        return new GovernanceException(GovernanceErrorKind.NOT_AUTHENTICATED, GovernanceStage.RESOLVING_ACTOR,
                "No authenticated actor for this request");
    }

    public static GovernanceException noMembership(String detail) {
        return new GovernanceException(GovernanceErrorKind.NO_MEMBERSHIP, GovernanceStage.RESOLVING_ACTOR, detail);
    }

    public static GovernanceException notFound(GovernanceStage stage, String detail) {
        return new GovernanceException(GovernanceErrorKind.NOT_FOUND, stage, detail);
    }

    public static GovernanceException forbidden(GovernanceStage stage, String detail) {
        return new GovernanceException(GovernanceErrorKind.FORBIDDEN, stage, detail);
    }

    public static GovernanceException validation(String detail) {
        return new GovernanceException(GovernanceErrorKind.VALIDATION_ERROR, GovernanceStage.TARGET_VALIDATION, detail);
    }

    public static GovernanceException alreadyActive(String detail) {
        return new GovernanceException(GovernanceErrorKind.ALREADY_ACTIVE, GovernanceStage.TARGET_VALIDATION, detail);
    }

    public static GovernanceException concurrentMutation(String detail, Throwable cause) {
        return new GovernanceException(GovernanceErrorKind.CONCURRENT_MUTATION, GovernanceStage.MUTATION, detail, cause);
    }

    @Override
    public GovernanceErrorKind getKind() {
        return kind;
    }

    @Override
    public GovernanceStage getGovernanceStage() {
        return stage;
    }

    @Override
    public String getStage() {
        return stage != null ? stage.name() : null;
    }
}
