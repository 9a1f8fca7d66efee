package com.phillippitts.voicenav.service.typing;

import com.phillippitts.voicenav.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Last tier: nothing reaches the focused application, the dictation is only reported in the
 * log. Always succeeds so the chain ends here.
 */
class NotifyOnlyAdapter implements TypingAdapter {
    private static final Logger LOG = LogManager.getLogger(NotifyOnlyAdapter.class);

    @Override
    public boolean canType() {
        return true;
    }

    @Override
    public boolean type(String text) {
        int length = text == null ? 0 : text.length();
        LOG.info("No input method could type the dictation ({} chars); see DEBUG for a preview", length);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Undelivered dictation: '{}'", LogSanitizer.truncate(text, 120));
        }
        return true;
    }

    @Override
    public String name() {
        return "notify";
    }
}
