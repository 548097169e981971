package com.example.circlecrawler;

import com.example.circlecrawler.api.Action;
import com.example.circlecrawler.api.Build;
import com.example.circlecrawler.api.Project;

/**
 * A failure that ended the walk of one project, with the deepest point of the tree reached.
 * {@code build}, {@code stepName} and {@code action} are null when the failure happened above them.
 */
public record BranchFailure(
        Project project,
        Build build,
        String stepName,
        Action action,
        Throwable cause
) {
    public static BranchFailure atProject(Project project, Throwable cause) {
        return new BranchFailure(project, null, null, null, cause);
    }

    public static BranchFailure atBuild(Project project, Build build, Throwable cause) {
        return new BranchFailure(project, build, null, null, cause);
    }

    public static BranchFailure atAction(Project project, Build build, String stepName, Action action, Throwable cause) {
        return new BranchFailure(project, build, stepName, action, cause);
    }

    /**
     * Human readable location, e.g. {@code github/acme/api build 42 step 'test' action 1}.
     */
    public String context() {
        StringBuilder builder = new StringBuilder(String.valueOf(project));
        if (build != null) {
            builder.append(" build ").append(build.buildNum());
        }
        if (stepName != null) {
            builder.append(" step '").append(stepName).append('\'');
        }
        if (action != null) {
            builder.append(" action ").append(action.index());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return context() + ": " + cause.getMessage();
    }
}
