package com.codemeter.core.language;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps a language name from the extension table to its {@link CommentFamily}.
 *
 * <p>Languages not listed here are counted with {@link CommentFamily#NONE}: blank lines are
 * still recognized, everything else is code.
 */
public final class LanguageFamilyClassifier {

    private static final Set<String> C_STYLE_LANGUAGES = Set.of(
        "ActionScript", "Apex Trigger", "Arduino Sketch", "AspectJ", "Astro", "Asymptote",
        "BizTalk Orchestration", "Blade", "C", "C#/Smalltalk", "C# Designer", "C++", "C/C++ Header",
        "Cairo", "Cake Build Script", "Carbon", "CCS", "Chapel", "Circom", "ColdFusion CFScript",
        "CSS", "CUDA", "D/dtrace", "Dart", "Derw", "DOORS Extension Language", "Drools",
        "ECPP", "Flatbuffers", "Gleam", "GLSL", "Go", "Godot Shaders", "Gradle", "Grails",
        "GraphQL", "Groovy", "Hare", "Haxe", "HLSL", "HolyC", "Imba", "Jai", "Java", "JavaScript",
        "JSON5", "JSX", "Kotlin", "LESS", "Logos", "Metal", "Mojo", "Nemerle", "Objective-C++",
        "Odin", "OpenSCAD", "P4", "Pest", "PHP", "PHP/Pascal/Fortran", "Prisma Schema",
        "Protocol Buffers", "PRQL", "QML", "RapydScript", "ReasonML", "ReScript", "Rust",
        "Scala", "SCSS", "Slice", "Solidity", "Squirrel", "Stylus", "Swift", "SWIG", "TableGen",
        "Thrift", "Titanium Style Sheet", "TypeScript", "TypeScript/Qt Linguist", "Umka", "Vala",
        "Vala Header", "Verilog-SystemVerilog", "WGSL", "WXSS", "X++", "Xtend", "Zig",
        "Razor", "Sass", "SugarSS", "Visualforce Component", "Visualforce Page", "PEG",
        "peg.js", "peggy", "tspeg", "yacc", "lex", "ANTLR Grammar", "Pony", "Kermit",
        "IDL", "Typst", "Vuejs Component", "Svelte"
    );

    private static final Set<String> HASH_LANGUAGES = Set.of(
        "awk", "Bazel", "Bourne Again Shell", "Bourne Shell", "C Shell", "CMake", "CoffeeScript",
        "Containerfile", "Crystal", "Cython", "dhall", "Dockerfile", "Elixir", "Expect",
        "Fish Shell", "GDScript", "Godot Resource", "Godot Scene", "HCL", "Korn Shell",
        "kvlang", "make", "Meson", "Nim", "Nix", "Perl", "Perl/Prolog", "PowerShell", "Properties",
        "Python", "R", "Raku", "Raku/Prolog", "Rmd", "RobotFramework", "Ruby", "Snakemake",
        "Starlark", "Tcl/Tk", "TOML", "Vyper", "YAML", "zsh", "sed", "m4", "Cucumber",
        "Juniper Junos"
    );

    private static final Set<String> DOUBLE_DASH_LANGUAGES = Set.of(
        "Ada", "Agda", "Elm", "Futhark", "Haskell", "Idris", "Literate Idris", "Lua",
        "Oracle PL/SQL", "PureScript", "SQL", "SQL Data", "SQL Stored Procedure", "VHDL",
        "Pig Latin", "Lean"
    );

    private static final Set<String> SEMICOLON_LANGUAGES = Set.of(
        "Assembly", "Clojure", "ClojureC", "ClojureScript", "Fennel", "INI", "LFE", "Lisp",
        "Lisp/Julia", "Lisp/OpenCL", "LLVM IR", "Racket", "Scheme", "Scheme/SaltStack",
        "AutoHotkey", "Windows Module Definition", "NASTRAN DMAP", "Gencat NLS"
    );

    private static final Set<String> PERCENT_LANGUAGES = Set.of(
        "Erlang", "MATLAB/Objective-C", "TeX", "Visual Basic/TeX/Apex Class", "Logtalk",
        "Prolog", "Mathematica"
    );

    private static final Set<String> XML_LANGUAGES = Set.of(
        "Ant", "ASP.NET", "DITA", "DTD", "FXML", "Glade", "Handlebars", "HTML", "JavaServer Faces",
        "JSP", "Mustache", "MXML", "NAnt script", "Qt/Glade", "SVG", "Unity-Prefab",
        "Web Services Description", "WiX include", "WiX source", "WiX string localization",
        "WXML", "XAML", "XHTML", "XMI", "XML", "XSD", "XSLT", "Markdown", "Maven", "MSBuild script"
    );

    private final Map<String, CommentFamily> families;

    /**
     * Creates a classifier with the built-in language groups.
     */
    public LanguageFamilyClassifier() {
        this(Map.of());
    }

    /**
     * Creates a classifier with the built-in groups plus explicit overrides.
     *
     * @param overrides language name to family entries that replace the built-in assignment
     */
    public LanguageFamilyClassifier(Map<String, CommentFamily> overrides) {
        Map<String, CommentFamily> map = new HashMap<>();
        register(map, C_STYLE_LANGUAGES, CommentFamily.C_STYLE);
        register(map, HASH_LANGUAGES, CommentFamily.HASH);
        register(map, DOUBLE_DASH_LANGUAGES, CommentFamily.DOUBLE_DASH);
        register(map, SEMICOLON_LANGUAGES, CommentFamily.SEMICOLON);
        register(map, PERCENT_LANGUAGES, CommentFamily.PERCENT);
        register(map, XML_LANGUAGES, CommentFamily.XML);
        map.putAll(overrides);
        this.families = Map.copyOf(map);
    }

    /**
     * Returns the comment family of a language.
     *
     * @param language language name as it appears in the extension table
     * @return comment family, {@link CommentFamily#NONE} if the language is unknown
     */
    public CommentFamily classify(String language) {
        if (language == null) {
            return CommentFamily.NONE;
        }
        return families.getOrDefault(language, CommentFamily.NONE);
    }

    private static void register(Map<String, CommentFamily> map, Set<String> languages, CommentFamily family) {
        for (String language : languages) {
            CommentFamily previous = map.putIfAbsent(language, family);
            if (previous != null) {
                throw new IllegalStateException(
                    "Language " + language + " assigned to both " + previous + " and " + family);
            }
        }
    }
}
