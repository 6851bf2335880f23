package com.robotlang.app;

import com.robotlang.check.RobotProgramValidator;
import com.robotlang.config.RobotLangProperties;
import com.robotlang.model.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int status = run(args, System.in, System.out, System.err, RobotLangProperties.load());
        System.exit(status);
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err,
                   RobotLangProperties properties) {
        boolean printAst = false;
        boolean explain = false;
        String fileName = null;

        for (String arg : args) {
            switch (arg) {
                case "--ast" -> printAst = true;
                case "--explain" -> explain = true;
                case "-h", "--help" -> {
                    usage(out);
                    return 0;
                }
                default -> {
                    if (arg.startsWith("--") || fileName != null) {
                        usage(err);
                        return 2;
                    }
                    fileName = arg;
                }
            }
        }

        if (fileName == null) {
            out.print("Enter the name of the file to load (e.g. test_case.txt): ");
            out.flush();
            try {
                String line = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).readLine();
                fileName = line == null ? "" : line.trim();
            } catch (IOException e) {
                logger.error("Could not read the file name from standard input", e);
                return 2;
            }
            if (fileName.isEmpty()) {
                usage(err);
                return 2;
            }
        }

        Path file = Paths.get(fileName);
        String source;
        try {
            source = ProgramSource.read(file);
        } catch (IOException e) {
            logger.error("Error reading file {}: {}", file, e.toString());
            err.println("Error reading file " + file + ": " + e.getMessage());
            return 2;
        }
        logger.info("Loaded {} ({} chars)", file, source.length());

        ValidationResult result = new RobotProgramValidator(properties).check(source);
        out.println(result.valid() ? "True" : "False");

        if (explain) {
            result.failure().ifPresent(d -> err.println(d));
        }
        if (printAst && result.valid()) {
            out.println(result.program());
        }
        return result.valid() ? 0 : 1;
    }

    private static void usage(PrintStream to) {
        to.println("Usage: robot-validator [--ast] [--explain] [file]");
        to.println("  --ast      print the parsed program when it is valid");
        to.println("  --explain  print why the program was rejected");
    }
}
