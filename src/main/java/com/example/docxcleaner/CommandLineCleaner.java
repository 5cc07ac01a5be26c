package com.example.docxcleaner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 命令行模式：{@code docx-cleaner <input.docx> [output.docx] [--config=chars.json] [--overwrite] [--parallelism=N]}。
 * 没有位置参数时什么都不做（Web 模式）。
 */
@Slf4j
@Component
public class CommandLineCleaner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: docx-cleaner <input.docx> [output.docx] [--config=<chars.json>] [--overwrite] [--parallelism=<n>]";

    private final CleanerService cleanerService;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode = EXIT_OK;

    @Autowired
    public CommandLineCleaner(CleanerService cleanerService) {
        this(cleanerService, System.out, System.err);
    }

    CommandLineCleaner(CleanerService cleanerService, PrintStream out, PrintStream err) {
        this.cleanerService = cleanerService;
        this.out = out;
        this.err = err;
    }

    /** 简写参数换成 Spring 属性，其余原样保留 */
    public static String[] expandShorthand(String[] args) {
        List<String> res = new ArrayList<>(args.length);
        for (String a : args) {
            if (a.startsWith("--config=")) res.add("--docx-cleaner.chars-file=" + a.substring("--config=".length()));
            else if (a.equals("--overwrite")) res.add("--docx-cleaner.overwrite=true");
            else if (a.startsWith("--parallelism=")) res.add("--docx-cleaner.parallelism=" + a.substring("--parallelism=".length()));
            else res.add(a);
        }
        return res.toArray(new String[0]);
    }

    public static boolean hasInput(String[] args) {
        for (String a : args) if (!a.startsWith("--")) return true;
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) return;
        exitCode = run(positional);
    }

    int run(List<String> positional) {
        if (positional.size() > 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path input = Path.of(positional.get(0));
        if (!Files.isRegularFile(input)) {
            err.println("Error: File '" + input + "' does not exist.");
            return EXIT_USAGE;
        }
        Path output = positional.size() == 2 ? Path.of(positional.get(1)) : cleanerService.defaultOutputPath(input);

        try {
            CleanSummary summary = cleanerService.clean(input, output);
            printStatistics(summary, output);
            return EXIT_OK;
        } catch (CleanerException e) {
            log.error("clean failed: {}", e.describe(), e);
            err.println("Error: " + e.describe());
            return EXIT_FAILED;
        }
    }

    private void printStatistics(CleanSummary summary, Path output) {
        CharacterList chars = cleanerService.getCharacters();
        out.println();
        out.println("Character Removal Statistics:");
        out.println("============================");

        List<Map.Entry<Integer, Integer>> rows = new ArrayList<>(summary.getRemovedByCodePoint().entrySet());
        rows.sort(Map.Entry.<Integer, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<Integer, Integer>comparingByKey()));
        for (Map.Entry<Integer, Integer> r : rows) {
            out.println(chars.nameOf(r.getKey()) + " (" + CharacterList.formatCodePoint(r.getKey()) + "): " + r.getValue());
        }
        for (String w : summary.getWarnings()) out.println("Warning: copied unchanged - " + w);

        out.println();
        out.println("Parts processed: " + summary.getPartsProcessed());
        out.println("Total characters removed: " + summary.getCharactersRemoved());
        out.println("Saved as: " + output);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
