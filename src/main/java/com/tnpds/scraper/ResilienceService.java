package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Runs a shop's pipeline under the retry policy and always yields a record for it.
 * <p>
 * Each attempt starts from a fresh {@link ShopRecordBuilder} on the current session. A
 * failed attempt gets debug artifacts, then a fixed pause before the next one. Only
 * {@link SessionLostException} (or a session found dead before an attempt) replaces the
 * session; every other failure is retried on the same one. When the attempts run out, the
 * last attempt's partial record is returned with its {@link ErrorInfo}.
 * <p>
 * This is the only place pipeline failures are caught.
 *
 * @author PDS Scraper Team
 * @since 1.0
 */
public class ResilienceService {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceService.class);

    private final ShopPipeline pipeline;
    private final DebugArtifactService artifacts;
    private final RetryPolicy policy;
    private final Clock clock;

    public ResilienceService(ShopPipeline pipeline, DebugArtifactService artifacts, RetryPolicy policy, Clock clock) {
        this.pipeline = pipeline;
        this.artifacts = artifacts;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * @throws RunAbortedException when a replacement session cannot be opened; the run cannot continue
     */
    public ShopRecord process(SessionHolder sessions, ShopQuery query, RunOptions options) {
        ShopRecordBuilder builder = new ShopRecordBuilder(query);
        ErrorKind kind = ErrorKind.UNKNOWN_FAILURE;
        String message = "";
        int attemptsMade = 0;
        try {
            for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
                PortalSession session = sessions.current();
                if (!session.isAlive()) {
                    logger.warn("Browser session is no longer usable before shop {} attempt {}", query.id(), attempt);
                    session = sessions.replace();
                }
                builder = new ShopRecordBuilder(query);
                attemptsMade = attempt;
                try {
                    pipeline.run(session, query, options, builder);
                    ShopRecord record = builder.build(clock.instant());
                    logger.info("Shop {}: {} ({} bill items, attempt {})",
                        query.id(), record.status().value(), record.billItems().size(), attempt);
                    return record;
                } catch (ShopPipeline.StageFailure failure) {
                    RuntimeException cause = failure.getCause();
                    kind = kindOf(cause, failure.stage());
                    message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                    logger.warn("Shop {} attempt {}/{} failed during {} ({}): {}",
                        query.id(), attempt, policy.maxAttempts(), failure.stage(), kind.label(), message);
                    artifacts.capture(session, query.id(), attempt);
                    if (kind == ErrorKind.SESSION_LOST && attempt < policy.maxAttempts()) {
                        sessions.replace();
                    }
                }
                if (attempt < policy.maxAttempts()) {
                    Utils.pause(policy.pause());
                }
            }
        } catch (PortalUnavailableException e) {
            logger.error("No replacement session for shop {} after {} attempts: {}", query.id(), attemptsMade, e.getMessage());
            ErrorInfo error = new ErrorInfo(ErrorKind.SESSION_LOST, e.getMessage(), attemptsMade);
            throw new RunAbortedException(builder.error(error).build(clock.instant()), e);
        }
        logger.error("Giving up on shop {} after {} attempts: {} - {}", query.id(), policy.maxAttempts(), kind.label(), message);
        return builder.error(new ErrorInfo(kind, message, policy.maxAttempts())).build(clock.instant());
    }

    static ErrorKind kindOf(RuntimeException failure, PipelineStage stage) {
        if (failure instanceof PortalException portal && portal.kind() != ErrorKind.UNKNOWN_FAILURE) {
            return portal.kind();
        }
        return stage.fallbackKind();
    }
}
