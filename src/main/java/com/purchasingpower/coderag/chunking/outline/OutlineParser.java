package com.purchasingpower.coderag.chunking.outline;

import com.purchasingpower.coderag.exception.SourceParseException;

/**
 * Builds a {@link SourceOutline} for one language.
 */
public interface OutlineParser {

    /**
     * @throws SourceParseException when the text is not valid for the language
     */
    SourceOutline parse(String content, String filePath);
}
