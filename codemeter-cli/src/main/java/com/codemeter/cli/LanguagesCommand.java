package com.codemeter.cli;

import com.codemeter.core.language.ExtensionTable;
import com.codemeter.core.language.LanguageFamilyClassifier;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * Command to list known languages, their extension keys and comment family.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Everything
 * codemeter languages
 *
 * # Languages whose name contains "script"
 * codemeter languages script
 * }</pre>
 */
@Command(
    name = "languages",
    description = "List known languages with their extensions and comment style",
    mixinStandardHelpOptions = true
)
public class LanguagesCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Only show languages whose name contains this text (case-insensitive)"
    )
    private String filter;

    @Override
    public Integer call() {
        ExtensionTable table = ExtensionTable.loadDefault();
        LanguageFamilyClassifier classifier = new LanguageFamilyClassifier();
        String needle = filter != null ? filter.toLowerCase(Locale.ROOT) : null;

        Map<String, Set<String>> byLanguage = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        byLanguage.putAll(table.extensionsByLanguage());

        int shown = 0;
        for (Map.Entry<String, Set<String>> entry : byLanguage.entrySet()) {
            String language = entry.getKey();
            if (needle != null && !language.toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }
            shown++;
            System.out.printf("  • %s [%s]%n", language, classifier.classify(language));
            System.out.printf("    Extensions: %s%n", String.join(" ", entry.getValue()));
        }

        if (shown == 0) {
            System.out.println("  No languages found.");
        } else {
            System.out.println();
            System.out.printf("%d languages%n", shown);
        }
        return 0;
    }
}
