package org.smileyface.newscrawler.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Arguments of the {@code translate} command:
 * {@code translate <inputFile> <targetLanguage> [-o|--output <outputFile>]}.
 */
public record TranslateArguments(Path input, String language, Path output) {

    public static final String USAGE = "translate <inputFile> <targetLanguage> [-o|--output <outputFile>]";

    /**
     * @param args the arguments following the command name
     * @throws IllegalArgumentException when an argument is missing or unknown
     */
    public static TranslateArguments parse(List<String> args) {
        List<String> positional = new ArrayList<>();
        String output = null;
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-o".equals(arg) || "--output".equals(arg)) {
                if (i + 1 >= args.size()) {
                    throw new IllegalArgumentException(arg + " requires a file name");
                }
                output = args.get(++i);
            } else if (arg.startsWith("--output=")) {
                output = arg.substring("--output=".length());
            } else if (arg.startsWith("-") && arg.length() > 1) {
                throw new IllegalArgumentException("Unknown option " + arg);
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected <inputFile> <targetLanguage>, got " + positional);
        }
        Path input = Path.of(positional.get(0));
        String language = positional.get(1).trim();
        if (language.isEmpty()) {
            throw new IllegalArgumentException("Target language must not be blank");
        }
        Path out = output == null || output.isBlank() ? defaultOutput(input, language) : Path.of(output);
        return new TranslateArguments(input, language, out);
    }

    /**
     * {@code news.json} with language {@code bn} becomes {@code news_translated_bn.json}.
     */
    static Path defaultOutput(Path input, String language) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        return input.resolveSibling(base + "_translated_" + language + ext);
    }
}
