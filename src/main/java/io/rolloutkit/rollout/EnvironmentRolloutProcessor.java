package io.rolloutkit.rollout;

import io.rolloutkit.mcp.ConnectionManager;
import io.rolloutkit.model.ErrorInfo;
import io.rolloutkit.model.EvalMetadata;
import io.rolloutkit.model.EvaluationRow;
import io.rolloutkit.model.Message;
import io.rolloutkit.model.RolloutRequest;
import io.rolloutkit.model.Session;
import io.rolloutkit.model.Status;
import io.rolloutkit.model.Trajectory;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Runs a row as one environment rollout: opens a fresh session per attempt, drives it with
 * a {@link RolloutExecutor}, and writes the conversation and reward back into the row.
 * The row's first system message becomes the system prompt and its first user message the
 * user prompt template.
 */
public final class EnvironmentRolloutProcessor implements RolloutProcessor {
    private final ConnectionManager connections;
    private final RolloutExecutor executor;
    private final BiFunction<EvaluationRow, RolloutContext, Session> sessions;

    public EnvironmentRolloutProcessor(
            ConnectionManager connections,
            RolloutExecutor executor,
            BiFunction<EvaluationRow, RolloutContext, Session> sessions
    ) {
        this.connections = connections;
        this.executor = executor;
        this.sessions = sessions;
    }

    @Override
    public EvaluationRow process(EvaluationRow row, RolloutContext context) {
        Session session = sessions.apply(row, context);
        Trajectory trajectory;
        try {
            connections.initialize(session);
            trajectory = executor.run(new RolloutRequest(
                    context.rowIndex(),
                    session,
                    firstContent(row, Message.ROLE_SYSTEM),
                    firstContent(row, Message.ROLE_USER)
            ));
        } finally {
            connections.close(session);
        }
        if (trajectory.failed()) {
            // Keep the partial conversation; the runner decides whether to retry.
            return row.withMessages(trajectory.conversation()).withStatus(Status.error(
                    trajectory.failure(),
                    List.of(new ErrorInfo(ErrorInfo.REASON_ROLLOUT_FAILED, RetryingRolloutRunner.ERROR_DOMAIN, Map.of(
                            "steps", trajectory.steps(),
                            "attempt", context.attempt()
                    )))
            ));
        }
        EvalMetadata metadata = row.evalMetadata() == null ? EvalMetadata.named("rollout") : row.evalMetadata();
        return row.withMessages(trajectory.conversation())
                .withEvalMetadata(metadata.withScore(trajectory.totalReward(), trajectory.totalReward() > 0.0))
                .withStatus(Status.finished("Rollout finished: " + trajectory.terminationReason().wireValue()));
    }

    private static String firstContent(EvaluationRow row, String role) {
        for (Message message : row.messages()) {
            if (role.equals(message.role())) {
                return message.content();
            }
        }
        return null;
    }
}
