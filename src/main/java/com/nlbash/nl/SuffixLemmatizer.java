package com.nlbash.nl;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Noun lemmatizer driven by English plural suffix rules and a short list of irregular forms.
 * Only lower-case alphabetic words are touched, so quoted literals and acronyms pass through.
 */
public class SuffixLemmatizer implements Lemmatizer {
    private static final ImmutableMap<String, String> IRREGULAR = Maps.mutable.<String, String>empty()
            .withKeyValue("children", "child")
            .withKeyValue("men", "man")
            .withKeyValue("women", "woman")
            .withKeyValue("people", "person")
            .withKeyValue("feet", "foot")
            .withKeyValue("teeth", "tooth")
            .withKeyValue("mice", "mouse")
            .withKeyValue("indices", "index")
            .withKeyValue("matrices", "matrix")
            .withKeyValue("caches", "cache")
            .withKeyValue("does", "does")
            .withKeyValue("this", "this")
            .withKeyValue("bytes", "byte")
            .toImmutable();

    @Override
    public String lemmatize(String word) {
        if (!isLowerAlpha(word)) {
            return word;
        }
        String irregular = IRREGULAR.get(word);
        if (irregular != null) {
            return irregular;
        }
        int n = word.length();
        if (n > 4 && word.endsWith("ies")) {
            return word.substring(0, n - 3) + "y";
        }
        if (word.endsWith("sses")) {
            return word.substring(0, n - 2);
        }
        if (n > 4 && (word.endsWith("ches") || word.endsWith("shes")
                || word.endsWith("xes") || word.endsWith("zes"))) {
            return word.substring(0, n - 2);
        }
        if (n > 3 && word.endsWith("s")
                && !word.endsWith("ss") && !word.endsWith("us") && !word.endsWith("is")) {
            return word.substring(0, n - 1);
        }
        return word;
    }

    private static boolean isLowerAlpha(String word) {
        if (word.isEmpty()) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < 'a' || c > 'z') {
                return false;
            }
        }
        return true;
    }
}
