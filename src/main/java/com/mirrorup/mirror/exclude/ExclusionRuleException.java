package com.mirrorup.mirror.exclude;

import com.mirrorup.mirror.service.MirrorUpException;

/**
 * Exclusion rules could not be read or parsed. Raised before any network activity.
 */
public class ExclusionRuleException extends MirrorUpException {
    public ExclusionRuleException(String message) {
        super(message);
    }

    public ExclusionRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
