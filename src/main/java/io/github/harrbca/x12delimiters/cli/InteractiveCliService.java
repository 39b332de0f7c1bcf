package io.github.harrbca.x12delimiters.cli;

import io.github.harrbca.x12delimiters.config.CliProperties;
import io.github.harrbca.x12delimiters.config.DelimiterProperties;
import io.github.harrbca.x12delimiters.x12.Delimiters;
import io.github.harrbca.x12delimiters.x12.IsaHeaderReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InteractiveCliService {

    private final IsaHeaderReader isaHeaderReader;
    private final DelimiterProperties delimiterProperties;
    private final CliProperties cliProperties;
    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private boolean running = true;

    @EventListener(ApplicationReadyEvent.class)
    public void startInteractiveCli() {
        Charset charset = cliProperties.getCharset();
        run(System.in, new PrintStream(System.out, true, charset), new PrintStream(System.err, true, charset));
    }

    void run(InputStream in, PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        running = true;

        if (cliProperties.isShowWelcomeMessage()) {
            out.println("\n=== X12 Delimiter CLI ===");
            out.println("Type 'help' for available commands, 'quit' to exit\n");
        }

        Scanner scanner = new Scanner(in, cliProperties.getCharset());

        while (running) {
            out.print(cliProperties.getPrompt());
            if (!scanner.hasNextLine()) {
                break;
            }
            String input = scanner.nextLine().trim();

            if (!input.isEmpty()) {
                processCommand(input);
            }
        }

        scanner.close();
        out.println("CLI session ended.");
    }

    private void processCommand(String input) {
        String[] parts = input.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String args = parts.length > 1 ? parts[1] : "";

        try {
            switch (command) {
                case "help" -> showHelp();
                case "detect" -> handleDetect(args);
                case "header" -> handleHeader(args);
                case "check" -> handleCheck(args);
                case "default" -> printDelimiters(delimiterProperties.toDelimiters());
                case "quit", "exit" -> {
                    running = false;
                    out.println("Goodbye!");
                }
                default -> out.println("Unknown command: " + command + ". Type 'help' for available commands.");
            }
        } catch (Exception e) {
            err.println("Error executing command: " + e.getMessage());
            log.debug("Command error details", e);
        }
    }

    private void showHelp() {
        out.println("""
            Available commands:

            Detection:
              detect <path>       - Read the ISA header of a file and show its delimiters
                - Example: detect /data/incoming/po_850.edi
              header <text>       - Show the delimiters of a raw ISA header typed on the line
              check <seg> <elem> <sub>
                - Check that three delimiter characters can be used together
                - Example: check ~ * :
              default             - Show the configured fallback delimiters

            General:
              help                - Show this help message
              quit/exit           - Exit the CLI
            """);
    }

    private void handleDetect(String args) {
        if (args.isEmpty()) {
            out.println("Usage: detect <path>");
            return;
        }

        Path file = Paths.get(args);
        if (!Files.exists(file)) {
            out.println("File not found: " + args);
            return;
        }

        printDelimiters(isaHeaderReader.read(file));
    }

    private void handleHeader(String args) {
        if (args.isEmpty()) {
            out.println("Usage: header <text>");
            return;
        }

        printDelimiters(isaHeaderReader.read(args));
    }

    private void handleCheck(String args) {
        String[] chars = args.split("\\s+");
        if (chars.length != 3 || !isDelimiterChar(chars[0]) || !isDelimiterChar(chars[1]) || !isDelimiterChar(chars[2])) {
            out.println("Usage: check <seg> <elem> <sub>");
            out.println("Example: check ~ * :");
            out.println("Each delimiter must be a single character between U+0000 and U+00FF");
            return;
        }

        printDelimiters(new Delimiters(
                Delimiters.code(chars[0].charAt(0)),
                Delimiters.code(chars[1].charAt(0)),
                Delimiters.code(chars[2].charAt(0))));
    }

    // one character that fits in a single byte
    private static boolean isDelimiterChar(String s) {
        return s.length() == 1 && s.charAt(0) <= 0xFF;
    }

    private void printDelimiters(Delimiters delimiters) {
        out.println("  Segment terminator:    " + Delimiters.display(delimiters.getSegmentTerminator()));
        out.println("  Element separator:     " + Delimiters.display(delimiters.getElementSeparator()));
        out.println("  Sub-element separator: " + Delimiters.display(delimiters.getSubElementSeparator()));
        out.println(delimiters.areValid() ? "✓ Valid" : "✗ Invalid: delimiters must all be different");
    }
}
