package com.coderenew.core.optimizer;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Exact token counts using the cl100k_base byte-pair encoding.
 */
public class BpeTokenCounter implements TokenCounter {

    private final Encoding encoding;

    public BpeTokenCounter() {
        this.encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }

    @Override
    public String name() {
        return encoding.getName();
    }
}
