package com.tnpds.scraper;

import com.tnpds.scraper.session.PortalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One attempt at a shop: navigate, classify, and extract when the shop is online and
 * details are wanted. Fills the builder as it goes and throws on the first failure;
 * retrying is the caller's business.
 */
public class ShopPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ShopPipeline.class);

    private final NavigationServiceInterface navigation;
    private final StatusClassifier classifier;
    private final DetailPageReader detailReader;
    private final TransactionExtractorInterface extractor;

    public ShopPipeline(NavigationServiceInterface navigation, StatusClassifier classifier,
                        DetailPageReader detailReader, TransactionExtractorInterface extractor) {
        this.navigation = navigation;
        this.classifier = classifier;
        this.detailReader = detailReader;
        this.extractor = extractor;
    }

    /**
     * Thrown failures are wrapped so the caller knows which stage they came from.
     */
    public static final class StageFailure extends RuntimeException {
        private final PipelineStage stage;

        StageFailure(PipelineStage stage, RuntimeException cause) {
            super(cause.getMessage(), cause);
            this.stage = stage;
        }

        public PipelineStage stage() {
            return stage;
        }

        @Override
        public synchronized RuntimeException getCause() {
            return (RuntimeException) super.getCause();
        }
    }

    public void run(PortalSession session, ShopQuery query, RunOptions options, ShopRecordBuilder builder) {
        PipelineStage stage = PipelineStage.NAVIGATION;
        try {
            navigation.openShop(session, query);

            stage = PipelineStage.CLASSIFICATION;
            ShopStatus status = classifier.classify(session);
            builder.status(status);
            if (options.includeDetails()) {
                builder.shopDetails(detailReader.readDetails(session));
            }

            if (status != ShopStatus.ONLINE || !options.includeDetails()) {
                logger.debug("Shop {} is {}; skipping transaction extraction", query.id(), status.value());
                return;
            }
            stage = PipelineStage.EXTRACTION;
            builder.transaction(extractor.extract(session));
        } catch (RuntimeException e) {
            throw new StageFailure(stage, e);
        }
    }
}
