package ai.regen.rewrite;

import ai.regen.api.GenerationException;
import ai.regen.api.ModelSnapshot;
import ai.regen.generate.ContentGenerator;
import ai.regen.marker.FileBlueprint;
import ai.regen.marker.MarkerDefinition;
import ai.regen.marker.MarkerType.Guard;
import ai.regen.parse.MarkerParser;
import ai.regen.parse.ParsedDocument;
import ai.regen.parse.Region;
import ai.regen.util.IndentUtil;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites the marker bodies of one parsed document.
 *
 * <p>Text outside markers is carried over untouched. Guards keep their body, apart from seeding an empty guard with
 * its default content and re-indenting it when asked to. A generated marker is recomputed only when it is in the
 * affected set or has no baseline yet. If its body was edited by hand and its strategy would discard that edit, the
 * marker is reported as a conflict and left alone.
 */
public final class Rewriter {
    private static final Logger logger = LogManager.getLogger(Rewriter.class);

    private final ContentGenerator generator;

    public Rewriter(ContentGenerator generator) {
        this.generator = generator;
    }

    /**
     * @param document parsed document with baselines bound to its regions
     * @param affectedIds ids of markers whose dependencies changed
     * @param regenerateAll recompute every generated marker regardless of {@code affectedIds}
     */
    public RewriteResult rewrite(
            ParsedDocument document,
            FileBlueprint blueprint,
            ModelSnapshot model,
            Set<String> affectedIds,
            boolean regenerateAll) {
        var file = document.file();
        var sep = document.lineSeparator();
        var current = document;
        var evaluated = new LinkedHashSet<String>();
        var regenerated = new LinkedHashSet<String>();
        var seeded = new LinkedHashSet<String>();
        var conflicts = new ArrayList<Conflict>();
        var errors = new ArrayList<GenerationError>();
        Map<String, String> baselines = new HashMap<>();
        int invocations = 0;

        for (var region : document.regions()) {
            var resolved = blueprint.resolve(region.kind(), region.id());
            if (resolved.isEmpty()) {
                errors.add(new GenerationError(
                        file,
                        region.id(),
                        GenerationException.Reason.NO_DEFINITION,
                        "no definition for " + region.kind() + " marker"));
                continue;
            }
            MarkerDefinition definition = resolved.get();
            if (definition.kind() != region.kind()) {
                errors.add(new GenerationError(
                        file,
                        region.id(),
                        GenerationException.Reason.KIND_MISMATCH,
                        "file has a " + region.kind() + " marker but it is defined as " + definition.kind()));
                continue;
            }

            if (definition.type() instanceof Guard guard) {
                var body = guardBody(guard, region, sep);
                if (!body.equals(region.rawContent())) {
                    if (region.rawContent().isBlank()) {
                        var invalid = delimiterError(document, region, body, "default content");
                        if (invalid != null) {
                            errors.add(invalid);
                            continue;
                        }
                        seeded.add(region.id());
                    }
                    current = current.withRegion(region.withContent(body));
                }
                continue;
            }

            if (!regenerateAll && !affectedIds.contains(region.id()) && region.baselineContent() != null) {
                continue;
            }
            evaluated.add(region.id());

            invocations++;
            var raw = region.rawContent();
            var existing = BodyFormatter.unformat(raw, region.indent());
            String proposal;
            try {
                proposal = generator.generate(definition, existing, model);
            } catch (GenerationException e) {
                logger.warn("Could not generate {} in {}: {}", region.id(), file, e.getMessage());
                errors.add(GenerationError.of(file, region.id(), e));
                continue;
            }
            var proposedRaw = BodyFormatter.format(proposal, region.indent(), sep);
            var invalid = delimiterError(document, region, proposedRaw, "generated content");
            if (invalid != null) {
                errors.add(invalid);
                continue;
            }
            if (proposal.equals(existing) || proposedRaw.equals(raw)) {
                baselines.put(region.id(), raw);
                continue;
            }

            var baseline = region.baselineContent();
            boolean diverged = baseline != null ? !raw.equals(baseline) : !raw.isBlank();
            if (diverged && definition.type().discardsExistingContent()) {
                var reason = baseline != null
                        ? Conflict.Reason.EDITED_SINCE_LAST_RUN
                        : Conflict.Reason.UNTRACKED_CONTENT;
                conflicts.add(new Conflict(file, region.id(), region.kind(), reason, baseline, raw, proposedRaw));
                continue;
            }

            current = current.withRegion(region.withContent(proposedRaw));
            regenerated.add(region.id());
            baselines.put(region.id(), proposedRaw);
        }

        var text = current.render();
        var changed = !text.equals(document.source());
        logger.debug(
                "Rewrote {}: {} evaluated, {} regenerated, {} conflicts, {} errors",
                file,
                evaluated.size(),
                regenerated.size(),
                conflicts.size(),
                errors.size());
        return new RewriteResult(
                file, text, changed, evaluated, regenerated, seeded, conflicts, errors, baselines, invocations);
    }

    /** Error for {@code body} if splicing it into the region would add a marker delimiter to the document. */
    private static @Nullable GenerationError delimiterError(
            ParsedDocument document, Region region, String body, String what) {
        var line = MarkerParser.findDelimiterLine(body, document.profile());
        if (line.isEmpty()) {
            return null;
        }
        var message = what + " line " + line.getAsInt() + " reads as a marker delimiter";
        logger.warn("Refusing to write {} in {}: {}", region.id(), document.file(), message);
        return new GenerationError(
                document.file(), region.id(), GenerationException.Reason.INVALID_CONTENT, message);
    }

    static String guardBody(Guard guard, Region region, String lineSeparator) {
        var raw = region.rawContent();
        if (raw.isBlank() && guard.defaultContent() != null && !guard.defaultContent().isEmpty()) {
            return BodyFormatter.format(guard.defaultContent(), region.indent(), lineSeparator);
        }
        if (!guard.preserveIndent() || raw.isEmpty()) {
            return raw;
        }
        var lines = BodyFormatter.lines(raw);
        List<String> shifted = IndentUtil.shiftToColumn(lines, region.indent());
        if (shifted == lines) {
            return raw;
        }
        var sb = new StringBuilder(raw.length() + region.indent().length() * lines.size());
        for (var line : shifted) {
            sb.append(line).append(lineSeparator);
        }
        return sb.toString();
    }
}
