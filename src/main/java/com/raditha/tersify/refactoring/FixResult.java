package com.raditha.tersify.refactoring;

import java.util.List;

/**
 * Source text after applying every available fix.
 *
 * @param source       the rewritten source
 * @param applied      number of fixes applied
 * @param descriptions description of each applied fix, in application order
 */
public record FixResult(String source, int applied, List<String> descriptions) {

    public FixResult {
        descriptions = List.copyOf(descriptions);
    }

    public boolean changed() {
        return applied > 0;
    }
}
