package de.mirkosertic.newsclassifier.analysis;

import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Word forms that bypass the regular Porter rules.
 *
 * <p>The table is maintained as stem -&gt; surface forms and inverted once into an
 * immutable form -&gt; stem lookup. Some forms map to themselves (e.g. {@code news}),
 * which protects them from any suffix stripping.</p>
 */
public final class IrregularForms {

    private static final Map<String, List<String>> FORMS_BY_STEM;

    static {
        final Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("sky", List.of("sky", "skies"));
        table.put("die", List.of("dying"));
        table.put("lie", List.of("lying"));
        table.put("tie", List.of("tying"));
        table.put("news", List.of("news"));
        table.put("inning", List.of("innings", "inning"));
        table.put("outing", List.of("outings", "outing"));
        table.put("canning", List.of("cannings", "canning"));
        table.put("howe", List.of("howe"));
        table.put("proceed", List.of("proceed"));
        table.put("exceed", List.of("exceed"));
        table.put("succeed", List.of("succeed"));
        FORMS_BY_STEM = table;
    }

    private static final Map<String, String> STEM_BY_FORM = invert(FORMS_BY_STEM);

    private IrregularForms() {
    }

    private static Map<String, String> invert(final Map<String, List<String>> formsByStem) {
        final Map<String, String> result = new HashMap<>();
        for (final Map.Entry<String, List<String>> entry : formsByStem.entrySet()) {
            for (final String form : entry.getValue()) {
                result.put(form, entry.getKey());
            }
        }
        return Map.copyOf(result);
    }

    /**
     * Returns the canonical stem for an irregular form, or {@code null} if the word
     * is subject to the regular rules.
     */
    public static @Nullable String lookup(final String word) {
        return STEM_BY_FORM.get(word);
    }

    /**
     * Returns the immutable form -&gt; stem table.
     */
    public static Map<String, String> asMap() {
        return STEM_BY_FORM;
    }
}
