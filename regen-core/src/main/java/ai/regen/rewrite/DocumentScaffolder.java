package ai.regen.rewrite;

import ai.regen.lang.LanguageProfile;
import ai.regen.marker.FileBlueprint;
import ai.regen.marker.MarkerKind;
import ai.regen.parse.MarkerParser;
import java.util.HashSet;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Produces the initial text of a file that does not exist yet: delimiters with empty bodies. */
public final class DocumentScaffolder {
    private static final Logger logger = LogManager.getLogger(DocumentScaffolder.class);

    private static final Pattern SLOT = Pattern.compile("^(\\s*)\\{\\{marker:([A-Za-z0-9_.\\-]+)}}\\s*$");

    private DocumentScaffolder() {
        // utility class
    }

    /**
     * Without a skeleton, the markers are emitted in blueprint order separated by blank lines. With one, every slot
     * line {@code {{marker:id}}} becomes that marker's delimiter pair at the slot's indentation.
     *
     * @throws IllegalArgumentException if the skeleton names a marker the blueprint does not define
     */
    public static String scaffold(FileBlueprint blueprint, LanguageProfile profile, String lineSeparator) {
        var sb = new StringBuilder();
        var skeleton = blueprint.skeleton();
        if (skeleton == null) {
            var first = true;
            for (var definition : blueprint.markers()) {
                if (!first) {
                    sb.append(lineSeparator);
                }
                first = false;
                appendPair(sb, profile, definition.kind(), definition.id(), "", lineSeparator);
            }
            return sb.toString();
        }

        var byId = blueprint.byId();
        var placed = new HashSet<String>();
        var endsWithSlot = false;
        for (var line : skeleton.split("\\r?\\n", -1)) {
            var m = SLOT.matcher(line);
            endsWithSlot = m.matches();
            if (!endsWithSlot) {
                sb.append(line).append(lineSeparator);
                continue;
            }
            var definition = byId.get(m.group(2));
            if (definition == null) {
                throw new IllegalArgumentException("Skeleton references undefined marker " + m.group(2));
            }
            placed.add(definition.id());
            appendPair(sb, profile, definition.kind(), definition.id(), m.group(1), lineSeparator);
        }
        // the last skeleton line had no separator of its own
        if (!endsWithSlot) {
            sb.setLength(sb.length() - lineSeparator.length());
        }
        byId.keySet().stream()
                .filter(id -> !placed.contains(id))
                .forEach(id -> logger.debug("Marker {} has no slot in the skeleton and was not scaffolded", id));
        return sb.toString();
    }

    private static void appendPair(
            StringBuilder sb,
            LanguageProfile profile,
            MarkerKind kind,
            String id,
            String indent,
            String lineSeparator) {
        sb.append(indent).append(MarkerParser.delimiter(profile, kind, id, true)).append(lineSeparator);
        sb.append(indent).append(MarkerParser.delimiter(profile, kind, id, false)).append(lineSeparator);
    }
}
