package im.arun.booklink.colorize;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keyword and builtin-name lists of the interactive interpreter whose sessions are colorized.
 */
public class PythonVocabulary {

    public static final List<String> KEYWORDS = List.of(
        "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del",
        "elif", "else", "except", "exec", "finally", "for", "from", "global", "if", "import",
        "in", "is", "lambda", "nonlocal", "not", "or", "pass", "print", "raise", "return",
        "try", "while", "with", "yield");

    public static final List<String> BUILTINS = List.of(
        "abs", "all", "any", "ascii", "bin", "bool", "bytearray", "bytes", "callable", "chr",
        "classmethod", "compile", "complex", "delattr", "dict", "dir", "divmod", "enumerate",
        "eval", "filter", "float", "format", "frozenset", "getattr", "globals", "hasattr",
        "hash", "help", "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len",
        "list", "locals", "map", "max", "memoryview", "min", "next", "object", "oct", "open",
        "ord", "pow", "property", "range", "repr", "reversed", "round", "set", "setattr",
        "slice", "sorted", "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip",
        "None", "True", "False", "NotImplemented", "Ellipsis",
        "ArithmeticError", "AssertionError", "AttributeError", "BaseException", "EOFError",
        "Exception", "FileNotFoundError", "FloatingPointError", "ImportError", "IndentationError",
        "IndexError", "IOError", "KeyError", "KeyboardInterrupt", "LookupError", "MemoryError",
        "NameError", "NotImplementedError", "OSError", "OverflowError", "RecursionError",
        "RuntimeError", "StopIteration", "SyntaxError", "SystemExit", "TypeError",
        "UnboundLocalError", "UnicodeDecodeError", "UnicodeEncodeError", "UnicodeError",
        "ValueError", "Warning", "ZeroDivisionError");

    private final Set<String> keywords;
    private final Set<String> builtins;

    public PythonVocabulary() {
        this(KEYWORDS, BUILTINS);
    }

    public PythonVocabulary(Collection<String> keywords, Collection<String> builtins) {
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        this.builtins = Collections.unmodifiableSet(new LinkedHashSet<>(builtins));
    }

    /**
     * Standard vocabulary plus builtins the execution environment adds.
     */
    public static PythonVocabulary withExtraBuiltins(Collection<String> extra) {
        Set<String> builtins = new LinkedHashSet<>(BUILTINS);
        builtins.addAll(extra);
        return new PythonVocabulary(KEYWORDS, builtins);
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    public Set<String> getBuiltins() {
        return builtins;
    }
}
