package com.mathdocx.parser;

import com.mathdocx.expression.LargeOperators;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch table for LaTeX commands.
 *
 * <p>Built once in a static initializer and read-only afterwards, so it is
 * safe to share between any number of concurrently running parsers.
 *
 * <p>Command categories:
 * <ul>
 *   <li>Structural: {@code \frac}, {@code \sqrt}, {@code \text}</li>
 *   <li>Large operators: {@code \sum}, {@code \int}, ... (see {@link LargeOperators})</li>
 *   <li>Symbols: Greek letters, relations, arrows, mapped to Unicode glyphs</li>
 *   <li>Function names: {@code \sin}, {@code \log}, {@code \lim}, rendered upright</li>
 *   <li>Delimiter sizing: {@code \left}, {@code \right}, {@code \big}, ...</li>
 *   <li>Layout no-ops and spacing: {@code \displaystyle}, {@code \quad}, ...</li>
 * </ul>
 */
public final class LatexCommands {

    /**
     * How the parser handles a command.
     */
    public enum Kind {
        FRACTION,
        SQRT,
        TEXT,
        STYLE,
        LARGE_OPERATOR,
        LIMITS,
        NOLIMITS,
        DELIMITER,
        LAYOUT,
        SPACE,
        SYMBOL,
        FUNCTION,
        UNKNOWN
    }

    private static final Map<String, Kind> KINDS = new HashMap<>();
    private static final Map<String, String> SYMBOLS = new HashMap<>();
    private static final Set<String> FUNCTIONS = new HashSet<>();

    static {
        initializeStructural();
        initializeSymbols();
        initializeFunctions();
        initializeLayout();
    }

    private LatexCommands() {}

    private static void initializeStructural() {
        for (String name : new String[] {"frac", "dfrac", "tfrac", "cfrac"}) {
            KINDS.put(name, Kind.FRACTION);
        }
        KINDS.put("sqrt", Kind.SQRT);
        for (String name : new String[] {"text", "textrm", "textit", "textbf", "mathrm", "operatorname", "mbox"}) {
            KINDS.put(name, Kind.TEXT);
        }
        for (String name : new String[] {"mathbf", "mathit", "mathsf", "mathtt", "mathcal",
                                         "mathbb", "mathfrak", "boldsymbol", "bm"}) {
            KINDS.put(name, Kind.STYLE);
        }
        for (String name : new String[] {"sum", "prod", "coprod", "bigcup", "bigcap",
                                         "int", "iint", "iiint", "oint"}) {
            if (LargeOperators.isLargeOperator(name)) {
                KINDS.put(name, Kind.LARGE_OPERATOR);
            }
        }
        KINDS.put("limits", Kind.LIMITS);
        KINDS.put("nolimits", Kind.NOLIMITS);
        for (String name : new String[] {"left", "right", "middle",
                                         "big", "Big", "bigg", "Bigg",
                                         "bigl", "bigr", "Bigl", "Bigr",
                                         "biggl", "biggr", "Biggl", "Biggr"}) {
            KINDS.put(name, Kind.DELIMITER);
        }
    }

    private static void initializeSymbols() {
        // Lowercase Greek
        symbol("alpha", "α");
        symbol("beta", "β");
        symbol("gamma", "γ");
        symbol("delta", "δ");
        symbol("epsilon", "ϵ");
        symbol("varepsilon", "ε");
        symbol("zeta", "ζ");
        symbol("eta", "η");
        symbol("theta", "θ");
        symbol("vartheta", "ϑ");
        symbol("iota", "ι");
        symbol("kappa", "κ");
        symbol("lambda", "λ");
        symbol("mu", "μ");
        symbol("nu", "ν");
        symbol("xi", "ξ");
        symbol("pi", "π");
        symbol("varpi", "ϖ");
        symbol("rho", "ρ");
        symbol("varrho", "ϱ");
        symbol("sigma", "σ");
        symbol("varsigma", "ς");
        symbol("tau", "τ");
        symbol("upsilon", "υ");
        symbol("phi", "ϕ");
        symbol("varphi", "φ");
        symbol("chi", "χ");
        symbol("psi", "ψ");
        symbol("omega", "ω");

        // Uppercase Greek
        symbol("Gamma", "Γ");
        symbol("Delta", "Δ");
        symbol("Theta", "Θ");
        symbol("Lambda", "Λ");
        symbol("Xi", "Ξ");
        symbol("Pi", "Π");
        symbol("Sigma", "Σ");
        symbol("Upsilon", "Υ");
        symbol("Phi", "Φ");
        symbol("Psi", "Ψ");
        symbol("Omega", "Ω");

        // Binary operators
        symbol("times", "×");
        symbol("cdot", "⋅");
        symbol("div", "÷");
        symbol("pm", "±");
        symbol("mp", "∓");
        symbol("ast", "∗");
        symbol("circ", "∘");
        symbol("bullet", "∙");
        symbol("cup", "∪");
        symbol("cap", "∩");
        symbol("setminus", "∖");
        symbol("land", "∧");
        symbol("wedge", "∧");
        symbol("lor", "∨");
        symbol("vee", "∨");
        symbol("oplus", "⊕");
        symbol("otimes", "⊗");

        // Relations
        symbol("leq", "≤");
        symbol("le", "≤");
        symbol("geq", "≥");
        symbol("ge", "≥");
        symbol("neq", "≠");
        symbol("ne", "≠");
        symbol("approx", "≈");
        symbol("equiv", "≡");
        symbol("sim", "∼");
        symbol("simeq", "≃");
        symbol("cong", "≅");
        symbol("propto", "∝");
        symbol("ll", "≪");
        symbol("gg", "≫");
        symbol("in", "∈");
        symbol("notin", "∉");
        symbol("ni", "∋");
        symbol("subset", "⊂");
        symbol("supset", "⊃");
        symbol("subseteq", "⊆");
        symbol("supseteq", "⊇");
        symbol("perp", "⊥");
        symbol("parallel", "∥");
        symbol("mid", "∣");

        // Arrows
        symbol("to", "→");
        symbol("rightarrow", "→");
        symbol("leftarrow", "←");
        symbol("gets", "←");
        symbol("Rightarrow", "⇒");
        symbol("Leftarrow", "⇐");
        symbol("leftrightarrow", "↔");
        symbol("Leftrightarrow", "⇔");
        symbol("mapsto", "↦");
        symbol("implies", "⟹");
        symbol("iff", "⟺");

        // Miscellaneous
        symbol("infty", "∞");
        symbol("partial", "∂");
        symbol("nabla", "∇");
        symbol("forall", "∀");
        symbol("exists", "∃");
        symbol("neg", "¬");
        symbol("lnot", "¬");
        symbol("emptyset", "∅");
        symbol("varnothing", "∅");
        symbol("prime", "′");
        symbol("hbar", "ℏ");
        symbol("ell", "ℓ");
        symbol("Re", "ℜ");
        symbol("Im", "ℑ");
        symbol("aleph", "ℵ");
        symbol("angle", "∠");
        symbol("degree", "°");
        symbol("cdots", "⋯");
        symbol("ldots", "…");
        symbol("dots", "…");
        symbol("vdots", "⋮");
        symbol("ddots", "⋱");

        // Delimiters
        symbol("langle", "⟨");
        symbol("rangle", "⟩");
        symbol("lfloor", "⌊");
        symbol("rfloor", "⌋");
        symbol("lceil", "⌈");
        symbol("rceil", "⌉");
        symbol("vert", "|");
        symbol("lvert", "|");
        symbol("rvert", "|");
        symbol("Vert", "‖");
        symbol("lVert", "‖");
        symbol("rVert", "‖");
        symbol("lbrace", "{");
        symbol("rbrace", "}");
    }

    private static void initializeFunctions() {
        for (String name : new String[] {
                "sin", "cos", "tan", "cot", "sec", "csc",
                "arcsin", "arccos", "arctan", "sinh", "cosh", "tanh", "coth",
                "log", "ln", "lg", "exp",
                "lim", "limsup", "liminf", "max", "min", "sup", "inf", "argmax", "argmin",
                "det", "dim", "ker", "gcd", "deg", "arg", "Pr", "mod", "bmod"}) {
            FUNCTIONS.add(name);
            KINDS.put(name, Kind.FUNCTION);
        }
    }

    private static void initializeLayout() {
        for (String name : new String[] {"displaystyle", "textstyle", "scriptstyle", "scriptscriptstyle"}) {
            KINDS.put(name, Kind.LAYOUT);
        }
        for (String name : new String[] {"quad", "qquad", "enspace", "thinspace",
                                         "medspace", "thickspace", "negthinspace"}) {
            KINDS.put(name, Kind.SPACE);
        }
    }

    private static void symbol(String name, String glyph) {
        SYMBOLS.put(name, glyph);
        KINDS.put(name, Kind.SYMBOL);
    }

    /**
     * Classifies a command name.
     *
     * @param name the command name without the backslash
     * @return the kind, {@link Kind#UNKNOWN} if not in the table
     */
    public static Kind kindOf(String name) {
        return KINDS.getOrDefault(name, Kind.UNKNOWN);
    }

    /**
     * Returns the Unicode glyph for a symbol command.
     *
     * @param name the command name without the backslash
     * @return the glyph, or null if the command is not a symbol
     */
    public static String glyphOf(String name) {
        return SYMBOLS.get(name);
    }

    /**
     * Returns whether a command is an upright function name such as {@code \sin}.
     *
     * @param name the command name without the backslash
     * @return true if it is a function name
     */
    public static boolean isFunction(String name) {
        return FUNCTIONS.contains(name);
    }

    /**
     * Returns the literal character produced by an escaped control symbol
     * such as {@code \{} or {@code \%}.
     *
     * @param c the character after the backslash
     * @return the literal text, or null if {@code c} is not an escape
     */
    static String escapedCharacter(char c) {
        switch (c) {
            case '{':
            case '}':
            case '%':
            case '$':
            case '&':
            case '#':
            case '_':
                return String.valueOf(c);
            case '|':
                return "‖";
            default:
                return null;
        }
    }

    /**
     * Returns whether a control symbol is a spacing command ({@code \,} and friends).
     *
     * @param c the character after the backslash
     * @return true for spacing
     */
    static boolean isSpacingSymbol(char c) {
        return c == ',' || c == ';' || c == ':' || c == '!' || c == ' ';
    }
}
