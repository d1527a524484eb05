package com.phillippitts.mathwords.service.registry;

import com.phillippitts.mathwords.exception.ParseException;
import com.phillippitts.mathwords.service.registry.CommandDescriptor.ArgumentShape;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of every control sequence the engine understands.
 *
 * <p>The table is assembled once from the vocabulary enums ({@link Operator},
 * {@link BigOperatorKind}, {@link MathFont}, ...) plus the symbol and function lists below,
 * then frozen. Lookups are safe for unsynchronized concurrent use.
 *
 * <p>Unknown names are not an error here: {@link #find(String)} returns empty and the parser
 * decides how to fail. User-defined macros ({@code \newcommand}) are never expanded.
 */
@Component
public class CommandRegistry {

    private static final Logger LOG = LogManager.getLogger(CommandRegistry.class);

    private final Map<String, CommandDescriptor> commands;
    private final Map<String, EnvironmentKind> environments;
    private final Map<String, String> glyphWords;
    private final Map<String, String> functionWords;

    public CommandRegistry() {
        Map<String, CommandDescriptor> table = new LinkedHashMap<>();
        Map<String, String> glyphs = new LinkedHashMap<>();
        Map<String, String> functions = new LinkedHashMap<>();

        registerSymbols(table, glyphs);
        registerFunctions(table, functions);

        for (Operator op : Operator.values()) {
            for (String name : op.commands()) {
                put(table, CommandDescriptor.nullary(name, CommandRole.OPERATOR, op));
            }
        }
        for (UnaryOperator op : UnaryOperator.values()) {
            for (String name : op.commands()) {
                if (op.isAccent()) {
                    put(table, CommandDescriptor.unary(name, CommandRole.ACCENT, ArgumentShape.GROUP_OR_TOKEN, op));
                } else {
                    put(table, CommandDescriptor.nullary(name, CommandRole.UNARY, op));
                }
            }
        }
        for (BigOperatorKind kind : BigOperatorKind.values()) {
            for (String name : kind.commands()) {
                put(table, CommandDescriptor.nullary(name, CommandRole.BIG_OPERATOR, kind));
            }
            glyphs.putIfAbsent(kind.glyph(), kind.spoken());
        }
        for (MathFont font : MathFont.values()) {
            for (String name : font.commands()) {
                put(table, CommandDescriptor.unary(name, CommandRole.FONT, ArgumentShape.GROUP_OR_TOKEN, font));
            }
        }
        for (Delimiter delimiter : Delimiter.values()) {
            for (String name : delimiter.commands()) {
                put(table, CommandDescriptor.nullary(name, CommandRole.DELIMITER, delimiter));
            }
        }

        for (String name : new String[] {"frac", "dfrac", "tfrac", "cfrac"}) {
            put(table, new CommandDescriptor(name, CommandRole.FRACTION, 2, ArgumentShape.GROUP_OR_TOKEN,
                    false, null, null, null));
        }
        for (String name : new String[] {"binom", "dbinom", "tbinom"}) {
            put(table, new CommandDescriptor(name, CommandRole.BINOMIAL, 2, ArgumentShape.GROUP_OR_TOKEN,
                    false, null, null, null));
        }
        put(table, new CommandDescriptor("sqrt", CommandRole.ROOT, 1, ArgumentShape.GROUP_OR_TOKEN,
                true, null, null, null));

        for (String name : new String[] {"text", "textrm", "textit", "textbf", "textsf", "texttt", "textnormal",
                "mbox", "hbox", "mathrm", "operatorname", "mathop"}) {
            put(table, CommandDescriptor.unary(name, CommandRole.TEXT, ArgumentShape.GROUP, null));
        }
        for (String name : new String[] {"left", "right", "middle", "big", "Big", "bigg", "Bigg", "bigl", "bigr",
                "Bigl", "Bigr", "biggl", "biggr", "Biggl", "Biggr", "bigm", "Bigm"}) {
            put(table, CommandDescriptor.nullary(name, CommandRole.SIZING, null));
        }
        for (String name : new String[] {",", ";", ":", "!", " ", "quad", "qquad", "enspace", "thinspace",
                "medspace", "thickspace", "negthinspace", "displaystyle", "textstyle", "scriptstyle",
                "scriptscriptstyle", "limits", "nolimits", "nonumber", "notag", "hfill", "mathstrut", "strut"}) {
            put(table, CommandDescriptor.nullary(name, CommandRole.SPACING, null));
        }
        for (String name : new String[] {"label", "tag", "hspace", "vspace", "phantom", "hphantom", "vphantom",
                "color"}) {
            put(table, CommandDescriptor.unary(name, CommandRole.DISCARD, ArgumentShape.GROUP, null));
        }
        put(table, CommandDescriptor.nullary("not", CommandRole.NEGATION, null));
        put(table, CommandDescriptor.nullary("begin", CommandRole.ENVIRONMENT, null));
        put(table, CommandDescriptor.nullary("end", CommandRole.ENVIRONMENT, null));

        Map<String, EnvironmentKind> envs = new LinkedHashMap<>();
        for (EnvironmentKind kind : EnvironmentKind.values()) {
            for (String name : kind.names()) {
                envs.put(name, kind);
            }
        }

        // Glyph readings for operators written directly as Unicode, used by the verbalizer and MathML input
        for (Operator op : Operator.values()) {
            if (!op.glyph().isEmpty()) {
                glyphs.putIfAbsent(op.glyph(), op.spoken());
            }
        }
        for (UnaryOperator op : UnaryOperator.values()) {
            glyphs.putIfAbsent(op.glyph(), op.spoken());
        }
        glyphs.put("ℝ", "the real numbers");
        glyphs.put("ℕ", "the natural numbers");
        glyphs.put("ℤ", "the integers");
        glyphs.put("ℚ", "the rational numbers");
        glyphs.put("ℂ", "the complex numbers");
        glyphs.put("°", "degrees");

        this.commands = Collections.unmodifiableMap(table);
        this.environments = Collections.unmodifiableMap(envs);
        this.glyphWords = Collections.unmodifiableMap(glyphs);
        this.functionWords = Collections.unmodifiableMap(functions);
        LOG.debug("Command registry initialized: {} commands, {} environments, {} glyphs",
                commands.size(), environments.size(), glyphWords.size());
    }

    private static void registerSymbols(Map<String, CommandDescriptor> table, Map<String, String> glyphs) {
        String[][] symbols = {
            {"alpha", "α", "alpha"}, {"beta", "β", "beta"}, {"gamma", "γ", "gamma"}, {"delta", "δ", "delta"},
            {"epsilon", "ϵ", "epsilon"}, {"varepsilon", "ε", "epsilon"}, {"zeta", "ζ", "zeta"},
            {"eta", "η", "eta"}, {"theta", "θ", "theta"}, {"vartheta", "ϑ", "theta"}, {"iota", "ι", "iota"},
            {"kappa", "κ", "kappa"}, {"lambda", "λ", "lambda"}, {"mu", "μ", "mu"}, {"nu", "ν", "nu"},
            {"xi", "ξ", "xi"}, {"omicron", "ο", "omicron"}, {"pi", "π", "pi"}, {"varpi", "ϖ", "pi"},
            {"rho", "ρ", "rho"}, {"varrho", "ϱ", "rho"}, {"sigma", "σ", "sigma"}, {"varsigma", "ς", "sigma"},
            {"tau", "τ", "tau"}, {"upsilon", "υ", "upsilon"}, {"phi", "ϕ", "phi"}, {"varphi", "φ", "phi"},
            {"chi", "χ", "chi"}, {"psi", "ψ", "psi"}, {"omega", "ω", "omega"},
            {"Gamma", "Γ", "capital gamma"}, {"Delta", "Δ", "capital delta"}, {"Theta", "Θ", "capital theta"},
            {"Lambda", "Λ", "capital lambda"}, {"Xi", "Ξ", "capital xi"}, {"Pi", "Π", "capital pi"},
            {"Sigma", "Σ", "capital sigma"}, {"Upsilon", "Υ", "capital upsilon"}, {"Phi", "Φ", "capital phi"},
            {"Psi", "Ψ", "capital psi"}, {"Omega", "Ω", "capital omega"},
            {"infty", "∞", "infinity"}, {"partial", "∂", "partial"}, {"nabla", "∇", "nabla"},
            {"forall", "∀", "for all"}, {"exists", "∃", "there exists"}, {"nexists", "∄", "there does not exist"},
            {"emptyset", "∅", "the empty set"}, {"varnothing", "⌀", "the empty set"},
            {"ldots", "…", "dot dot dot"}, {"dots", "…", "dot dot dot"}, {"cdots", "⋯", "dot dot dot"},
            {"vdots", "⋮", "vertical dots"}, {"ddots", "⋱", "diagonal dots"},
            {"prime", "′", "prime"}, {"hbar", "ℏ", "h bar"}, {"ell", "ℓ", "script l"},
            {"Re", "ℜ", "real part"}, {"Im", "ℑ", "imaginary part"}, {"aleph", "ℵ", "aleph"},
            {"angle", "∠", "angle"}, {"triangle", "△", "triangle"}, {"degree", "°", "degrees"},
            {"top", "⊤", "transpose"}, {"dagger", "†", "dagger"}, {"therefore", "∴", "therefore"},
            {"because", "∵", "because"}, {"square", "□", "square"},
            {"%", "%", "percent"}, {"$", "$", "dollar"}, {"#", "#", "number sign"}, {"&", "&", "and"},
            {"_", "_", "underscore"}
        };
        for (String[] s : symbols) {
            put(table, CommandDescriptor.symbol(s[0], s[1], s[2]));
            glyphs.putIfAbsent(s[1], s[2]);
        }
    }

    private static void registerFunctions(Map<String, CommandDescriptor> table, Map<String, String> functions) {
        String[][] names = {
            {"sin", "sine"}, {"cos", "cosine"}, {"tan", "tangent"}, {"cot", "cotangent"}, {"sec", "secant"},
            {"csc", "cosecant"}, {"arcsin", "arc sine"}, {"arccos", "arc cosine"}, {"arctan", "arc tangent"},
            {"sinh", "hyperbolic sine"}, {"cosh", "hyperbolic cosine"}, {"tanh", "hyperbolic tangent"},
            {"coth", "hyperbolic cotangent"}, {"log", "log"}, {"ln", "natural log"}, {"lg", "log"},
            {"exp", "exponential"}, {"det", "determinant"}, {"dim", "dimension"}, {"ker", "kernel"},
            {"deg", "degree"}, {"gcd", "greatest common divisor"}, {"arg", "argument"}, {"Pr", "probability"},
            {"hom", "hom"}, {"max", "maximum"}, {"min", "minimum"}, {"sup", "supremum"}, {"inf", "infimum"}
        };
        for (String[] f : names) {
            put(table, CommandDescriptor.function(f[0], f[1]));
            functions.put(f[0], f[1]);
        }
    }

    private static void put(Map<String, CommandDescriptor> table, CommandDescriptor descriptor) {
        CommandDescriptor previous = table.putIfAbsent(descriptor.name(), descriptor);
        if (previous != null) {
            throw new IllegalStateException("Duplicate command registration: \\" + descriptor.name());
        }
    }

    /**
     * @param name command name without backslash
     * @return descriptor, or empty when the command is not registered
     */
    public Optional<CommandDescriptor> find(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    /**
     * Resolves a command or fails with the parser's unknown-command error.
     *
     * @param name command name without backslash
     * @param position source offset of the command, for error reporting
     * @return descriptor
     * @throws ParseException of kind {@code UNKNOWN_COMMAND} when not registered
     */
    public CommandDescriptor require(String name, int position) {
        CommandDescriptor descriptor = commands.get(name);
        if (descriptor == null) {
            throw ParseException.unknownCommand(name, position);
        }
        return descriptor;
    }

    public boolean isKnown(String name) {
        return commands.containsKey(name);
    }

    public Optional<EnvironmentKind> environment(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    /**
     * English reading of a glyph such as {@code "α"} or {@code "∞"}.
     *
     * @param glyph symbol text
     * @return spoken word, or null when the glyph has no registered reading
     */
    public String spokenGlyph(String glyph) {
        return glyphWords.get(glyph);
    }

    /**
     * @param name function name such as {@code "sin"}
     * @return spoken name ("sine"), or null when it is not a registered function
     */
    public String spokenFunction(String name) {
        return functionWords.get(name);
    }

    public boolean isFunction(String name) {
        return functionWords.containsKey(name);
    }

    public int size() {
        return commands.size();
    }
}
