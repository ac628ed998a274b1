package com.purchasingpower.reviewflow.patterns;

import com.purchasingpower.reviewflow.model.pattern.PatternDefinition;
import com.purchasingpower.reviewflow.model.pattern.PatternScope;
import lombok.Getter;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A pattern definition with its regex and file globs compiled once.
 *
 * A definition whose regex or file glob does not compile is kept with its error; evaluating
 * it fails, and the rule engine skips it.
 */
@Getter
public class CompiledPattern {

    private final PatternDefinition definition;
    private final Pattern regex;
    private final String compileError;
    private final List<PathMatcher> pathMatchers;
    private final List<PathMatcher> nameMatchers;

    public CompiledPattern(PatternDefinition definition) {
        this.definition = definition;

        Pattern compiled = null;
        String error = null;
        try {
            int flags = definition.isCaseInsensitive() ? Pattern.CASE_INSENSITIVE : 0;
            if (definition.getScope() == PatternScope.HUNK) {
                flags |= Pattern.MULTILINE;
            }
            compiled = Pattern.compile(definition.getRegex(), flags);
        } catch (PatternSyntaxException e) {
            error = e.getDescription();
        }
        this.regex = compiled;

        this.pathMatchers = new ArrayList<>();
        this.nameMatchers = new ArrayList<>();
        List<String> globs = definition.getFileGlobs() != null ? definition.getFileGlobs() : List.of();
        for (String glob : globs) {
            try {
                addGlob(glob);
                if (glob.startsWith("**/")) {
                    // "**/" also covers files at the repository root
                    addGlob(glob.substring(3));
                }
            } catch (IllegalArgumentException e) {
                String globError = "invalid file glob '" + glob + "': " + e.getMessage();
                error = error == null ? globError : error + "; " + globError;
            }
        }
        this.compileError = error;
    }

    private void addGlob(String glob) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        if (glob.contains("/")) {
            pathMatchers.add(matcher);
        } else {
            nameMatchers.add(matcher);
        }
    }

    public String getId() {
        return definition.getId();
    }

    /**
     * Globs containing a slash match the full path, others only the file name.
     * No globs means every file.
     */
    public boolean appliesTo(String filePath) {
        if (pathMatchers.isEmpty() && nameMatchers.isEmpty()) {
            return true;
        }
        try {
            Path path = Path.of(filePath);
            Path name = path.getFileName();
            return pathMatchers.stream().anyMatch(m -> m.matches(path))
                    || (name != null && nameMatchers.stream().anyMatch(m -> m.matches(name)));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
