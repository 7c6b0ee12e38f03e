package org.dxworks.fortframe.analyzer.reader;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.SourceFormDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one source file into logical statements. Comments and continuations are removed, statements separated
 * by {@code ;} are split, {@code include} lines are replaced by the statements of the included file, and
 * documentation comments come out as separate statements starting with {@code !} followed by the doc mark.
 * <p>
 * Documentation read while a statement is being assembled is returned after that statement.
 */
public class FortranReader implements Iterator<String> {

    private static final Pattern INCLUDE = Pattern.compile("^include\\s*([\"'])(.*)\\1\\s*$", Pattern.CASE_INSENSITIVE);

    private enum AltMode { NONE, FOLLOWING, PRECEDING }

    private final Path file;
    private final SourceForm form;
    private final FortframeConfig config;
    private final Diagnostics diagnostics;
    private final DocMarks marks;
    private final IncludeResolver includeResolver;
    private final Set<Path> activeIncludes;
    private final String rawText;
    private final List<String> lines;

    private final Deque<String> pending = new ArrayDeque<>();
    private final Deque<String> docBuffer = new ArrayDeque<>();
    private int lineIndex = 0;
    private boolean prevDoc = false;
    private boolean predocPending = false;
    private AltMode altMode = AltMode.NONE;

    public FortranReader(Path file, SourceForm form, boolean preprocess, FortframeConfig config, Diagnostics diagnostics) {
        this(file, readSource(file, config), form, preprocess, config, diagnostics, new HashSet<>());
    }

    private FortranReader(Path file, String rawText, SourceForm form, boolean preprocess, FortframeConfig config,
                          Diagnostics diagnostics, Set<Path> activeIncludes) {
        this.file = file;
        this.form = form;
        this.config = config;
        this.diagnostics = diagnostics;
        this.marks = DocMarks.of(config);
        this.includeResolver = new IncludeResolver(config.getIncludeDirs());
        this.activeIncludes = activeIncludes;
        this.rawText = rawText;

        String text = rawText;
        if (preprocess) {
            text = new Preprocessor(config, diagnostics).process(file, text);
        }
        if (form == SourceForm.FIXED) {
            text = FixedFormConverter.toFreeForm(text, config.isFixedLengthLimit());
        }
        List<String> split = new ArrayList<>(List.of(text.split("\r?\n", -1)));
        if (split.size() > 1 && split.get(split.size() - 1).isEmpty()) {
            split.remove(split.size() - 1);
        }
        this.lines = List.copyOf(split);
    }

    /**
     * Reads statements from in-memory text, resolving includes relative to the directory of {@code name}.
     */
    public static FortranReader fromText(String name, String text, SourceForm form, FortframeConfig config,
                                         Diagnostics diagnostics) {
        return new FortranReader(Paths.get(name), text, form, false, config, diagnostics, new HashSet<>());
    }

    public Path getFile() {
        return file;
    }

    public String getRawText() {
        return rawText;
    }

    public DocMarks getDocMarks() {
        return marks;
    }

    /**
     * One-based number of the last physical line consumed.
     */
    public int getLineNumber() {
        return lineIndex;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && docBuffer.isEmpty()) {
            if (!readLogicalLine()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more statements in " + file);
        }
        if (!pending.isEmpty()) {
            prevDoc = false;
            return pending.poll();
        }
        String doc = docBuffer.poll();
        prevDoc = !doc.equals(marks.docPrefix());
        return doc;
    }

    /**
     * Pushes a statement back so that the next call to {@link #next()} returns it again.
     */
    public void passBack(String statement) {
        pending.addFirst(statement);
    }

    public List<String> readAll() {
        List<String> statements = new ArrayList<>();
        while (hasNext()) {
            statements.add(next());
        }
        return statements;
    }

    private boolean readLogicalLine() {
        if (lineIndex >= lines.size()) {
            return false;
        }
        StringBuilder lineBuffer = new StringBuilder();
        boolean continued = false;
        char bufferQuote = 0;

        while (true) {
            if (lineIndex >= lines.size()) {
                if (continued) {
                    diagnostics.warn(file + ": file ended while a line continuation was pending");
                }
                break;
            }
            String raw = lines.get(lineIndex++);
            if (raw.strip().startsWith("#")) {
                continue;
            }

            char quote = continued ? bufferQuote : 0;
            int bang = SourceText.commentStart(raw, quote);
            String code = bang >= 0 ? raw.substring(0, bang) : raw;
            if (bang >= 0) {
                readComment(raw.substring(bang + 1), code.isBlank());
            }

            if (code.isBlank()) {
                if (bang < 0) {
                    altMode = AltMode.NONE;
                    if (prevDoc && docBuffer.isEmpty()) {
                        docBuffer.add(marks.docPrefix());
                    }
                }
            } else {
                altMode = AltMode.NONE;
                predocPending = false;
                String lead = code.stripLeading();
                boolean leadingAmpersand = lead.startsWith("&");
                if (leadingAmpersand && !continued) {
                    throw new SourceReadException(file + ":" + lineIndex
                            + ": can not start a new line with '&'");
                }
                String line;
                if (quote != 0) {
                    // inside a literal the text after the leading '&' is kept as written
                    line = (leadingAmpersand ? lead.substring(1) : code).stripTrailing();
                } else {
                    line = (leadingAmpersand ? lead.substring(1) : lead).strip();
                }
                String segment;
                if (line.isEmpty()) {
                    continued = true;
                    segment = "";
                } else if (line.endsWith("&")) {
                    continued = true;
                    segment = line.substring(0, line.length() - 1);
                } else {
                    continued = false;
                    segment = line;
                }
                lineBuffer.append(segment);
                bufferQuote = SourceText.openQuote(segment, quote);
            }

            boolean hasContent = !docBuffer.isEmpty() || lineBuffer.length() > 0;
            if (hasContent && !continued && !predocPending) {
                break;
            }
        }

        for (String statement : SourceText.quoteSplit(';', lineBuffer.toString())) {
            String trimmed = statement.strip();
            if (!trimmed.isEmpty()) {
                enqueue(trimmed);
            }
        }
        return true;
    }

    private void readComment(String body, boolean commentOnly) {
        String predoc = marks.getPredocmark();
        String predocAlt = marks.getPredocmarkAlt();
        String docAlt = marks.getDocmarkAlt();
        if (!predoc.isEmpty() && body.startsWith(predoc)) {
            requireWholeLine(commentOnly);
            docBuffer.add(marks.docPrefix() + body.substring(predoc.length()));
            predocPending = true;
            altMode = AltMode.NONE;
        } else if (!predocAlt.isEmpty() && body.startsWith(predocAlt)) {
            requireWholeLine(commentOnly);
            docBuffer.add(marks.docPrefix() + body.substring(predocAlt.length()));
            predocPending = true;
            altMode = AltMode.PRECEDING;
        } else if (!docAlt.isEmpty() && body.startsWith(docAlt)) {
            requireWholeLine(commentOnly);
            docBuffer.add(marks.docPrefix() + body.substring(docAlt.length()));
            altMode = AltMode.FOLLOWING;
        } else if (body.startsWith(marks.getDocmark())) {
            docBuffer.add(marks.docPrefix() + body.substring(marks.getDocmark().length()));
            altMode = AltMode.NONE;
        } else if (altMode != AltMode.NONE && commentOnly) {
            docBuffer.add(marks.docPrefix() + body);
        }
    }

    private void requireWholeLine(boolean commentOnly) {
        if (!commentOnly) {
            throw new SourceReadException(file + ":" + lineIndex
                    + ": documentation blocks must start on their own line");
        }
    }

    private void enqueue(String statement) {
        Matcher include = INCLUDE.matcher(statement);
        if (!include.matches()) {
            pending.add(statement);
            return;
        }
        String name = include.group(2);
        Path dir = file.toAbsolutePath().getParent();
        Optional<Path> resolved = includeResolver.resolve(name, dir);
        if (resolved.isEmpty()) {
            if (SourceFormDetector.isFortranSource(Paths.get(name))) {
                throw new SourceReadException(file + ": included file '" + name + "' not found in "
                        + dir + " or the include directories");
            }
            diagnostics.warn(file + ": could not find included file '" + name + "', leaving the include in place");
            pending.add(statement);
            return;
        }
        Path target = resolved.get().toAbsolutePath().normalize();
        if (!activeIncludes.add(target)) {
            throw new SourceReadException(file + ": recursive include of " + target);
        }
        try {
            FortranReader included = new FortranReader(target, readSource(target, config), form, false, config,
                    diagnostics, activeIncludes);
            pending.addAll(included.readAll());
        } finally {
            activeIncludes.remove(target);
        }
    }

    static String readSource(Path file, FortframeConfig config) {
        try {
            String text = Files.readString(file, Charset.forName(config.getEncoding()));
            if (text.startsWith("\uFEFF")) {
                text = text.substring(1);
            }
            return text;
        } catch (IOException e) {
            throw new SourceReadException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }
}
