package org.kaleidoscope.compiler.api;

import org.kaleidoscope.compiler.frontend.parser.ast.TopLevelNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public, clean interface for the language frontend.
 */
public interface IFrontend {

    /**
     * Parses a whole source into its top-level units.
     *
     * @param source The source text.
     * @param sourceName A name for the source, used in diagnostics.
     * @return The definitions, externs and wrapped top-level expressions, in source order.
     * @throws CompilationException if any construct failed to parse. The exception carries
     *         every diagnostic of the run; the units that did parse are discarded.
     */
    List<TopLevelNode> parse(String source, String sourceName) throws CompilationException;

    /**
     * Parses a source file read as UTF-8.
     * @param sourcePath The path to the source file.
     * @return The top-level units, in source order.
     * @throws CompilationException if any construct failed to parse.
     * @throws IOException if the file cannot be read.
     */
    default List<TopLevelNode> parse(Path sourcePath) throws CompilationException, IOException {
        return parse(Files.readString(sourcePath, StandardCharsets.UTF_8), sourcePath.toString().replace('\\', '/'));
    }
}
