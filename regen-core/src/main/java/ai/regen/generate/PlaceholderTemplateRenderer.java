package ai.regen.generate;

import ai.regen.api.GenerationException;
import ai.regen.api.TemplateRenderer;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{name}}} placeholders. Whitespace inside the braces is ignored and names may be dotted paths.
 * A placeholder that resolves to nothing fails the whole render.
 */
public final class PlaceholderTemplateRenderer implements TemplateRenderer {
    static final Pattern PLACEHOLDER =
            Pattern.compile("\\{\\{\\s*([A-Za-z_][A-Za-z0-9_\\-]*(?:\\.[A-Za-z0-9_\\-]+)*)\\s*}}");

    @Override
    public String render(String template, VariableLookup variables) throws GenerationException {
        Matcher m = PLACEHOLDER.matcher(template);
        var out = new StringBuilder(template.length());
        while (m.find()) {
            var name = m.group(1);
            var value = variables.lookup(name);
            if (value.isEmpty()) {
                throw new GenerationException(
                        GenerationException.Reason.MISSING_VARIABLE, "no value for placeholder '" + name + "'");
            }
            m.appendReplacement(out, Matcher.quoteReplacement(ValueText.of(value.get())));
        }
        m.appendTail(out);
        return out.toString();
    }

    @Override
    public Set<String> referencedVariables(String template) {
        var names = new LinkedHashSet<String>();
        Matcher m = PLACEHOLDER.matcher(template);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }
}
