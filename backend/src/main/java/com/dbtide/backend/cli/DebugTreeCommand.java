package com.dbtide.backend.cli;

import com.dbtide.backend.exception.InvalidDocumentEncodingException;
import com.dbtide.backend.syntax.Parser;
import com.dbtide.backend.syntax.TreeRenderer;
import com.dbtide.backend.text.DocumentDecoder;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads a template from stdin and writes its tree dump to stdout.
 *
 * <p>Runs without the Spring context. Exits with 1 when stdin is not valid UTF-8.
 */
public final class DebugTreeCommand {

    private DebugTreeCommand() {
    }

    public static void main(String[] args) {
        PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        int status = run(System.in, out, System.err);
        out.flush();
        System.exit(status);
    }

    static int run(InputStream in, PrintStream out, PrintStream err) {
        try {
            String source = DocumentDecoder.decode(in.readAllBytes());
            out.print(TreeRenderer.render(Parser.parse(source)));
            return 0;
        } catch (InvalidDocumentEncodingException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("error: failed to read stdin: " + e.getMessage());
            return 1;
        }
    }
}
