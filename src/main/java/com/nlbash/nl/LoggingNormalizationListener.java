package com.nlbash.nl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNormalizationListener implements NormalizationListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingNormalizationListener.class);

    @Override
    public void onSpellCorrection(String before, String after) {
        logger.info("spell correction: {} -> {}", before, after);
    }

    @Override
    public void onQuotationViolation(QuotationViolation violation) {
        logger.warn("Quotation error: space inside word {} in sentence: {}",
                violation.token(), violation.sentence());
    }
}
