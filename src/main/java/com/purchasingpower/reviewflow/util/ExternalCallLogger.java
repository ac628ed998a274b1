package com.purchasingpower.reviewflow.util;

import com.purchasingpower.reviewflow.model.CallContext;
import com.purchasingpower.reviewflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Logging helpers shared by every external call (vector index, model providers).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
