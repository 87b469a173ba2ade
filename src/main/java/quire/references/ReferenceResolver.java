// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package quire.references;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Map;
import quire.tree.BibEntry;
import quire.tree.BibReference;
import quire.tree.Document;
import quire.tree.Element;
import quire.tree.ElementVisitor;
import quire.tree.ElementWalker;
import quire.tree.GlossaryReference;
import quire.tree.Inline;
import quire.tree.Placeholder;
import quire.util.Trace;
import quire.util.annotation.Nullable;

/**
 * The pass settling every deferred cell of a fully spliced document.
 * <p>
 * The pass runs in three steps. First, every {@code [[set:key][value=...]]} definition stores its value in the
 * configuration, so every placeholder sees every definition regardless of position. Then bibliography definitions
 * found in the document are registered, and citations and glossary references are assigned in document order.
 * Finally every remaining placeholder is resolved: the built-in names {@value #tocName}, {@value #dateName},
 * {@value #timeName}, {@value #dateTimeName}, {@value #bibliographyName} and {@value #glossaryName} first, then
 * configuration values, then anything else becomes unresolved, displayed as written.
 * <p>
 * Cells that are already settled are skipped, so running the pass again changes nothing.
 */
public final class ReferenceResolver {
    public static final String tocName = "toc";
    public static final String dateName = "date";
    public static final String timeName = "time";
    public static final String dateTimeName = "datetime";
    public static final String bibliographyName = "bibliography";
    public static final String glossaryName = "glossary";

    /**
     * Initializes a new pass whose {@code date} and {@code time} placeholders read the given clock.
     */
    public ReferenceResolver(final Clock clock) {
        this.clock = clock;
    }

    /**
     * Resolves a document with a pass reading the system clock.
     */
    public static void resolveDocument(final Document document) {
        new ReferenceResolver(Clock.systemDefaultZone()).resolve(document);
    }

    public void resolve(final Document document) {
        try (final var trace = new Trace("Resolving references")) {
            trace.use();
            final var shared = document.shared();
            processDefinitions(document, shared.configuration());
            assignReferences(document, shared);
            final var now = LocalDateTime.now(clock);
            for (final var placeholder : document.placeholders()) {
                if (!placeholder.value().isSettled()) {
                    resolvePlaceholder(placeholder, document, now);
                }
            }
        }
    }

    private static void processDefinitions(final Document document, final Configuration configuration) {
        for (final var placeholder : document.placeholders()) {
            final var key = placeholder.key();
            if (!key.startsWith(definitionPrefix) || placeholder.value().isSettled()) {
                continue;
            }
            final var metadata = placeholder.metadata();
            final var value = (metadata == null) ? null : metadata.get(definitionValue);
            if (value != null) {
                configuration.set(key.substring(definitionPrefix.length()).trim(), ConfigValue.fromMetadata(value));
            }
            placeholder.value().resolve(new Inline.Plain(""));
        }
    }

    private static void assignReferences(final Document document, final SharedState shared) {
        final var bibReferences = new ArrayList<BibReference>();
        final var glossaryReferences = new ArrayList<GlossaryReference>();
        ElementWalker.walk(document.blocks(), new ElementVisitor() {
            @Override
            public void visitBibEntry(final BibEntry entry) {
                shared.bibliography().define(entry);
            }

            @Override
            public void visitBibReference(final BibReference reference) {
                bibReferences.add(reference);
            }

            @Override
            public void visitGlossaryReference(final GlossaryReference reference) {
                glossaryReferences.add(reference);
            }
        });
        final var display = shared.configuration().text(ConfigKeys.bibRefDisplay);
        shared.bibliography().assign(bibReferences, (display == null) ? defaultBibRefDisplay : display);
        shared.glossary().assign(glossaryReferences);
    }

    private void resolvePlaceholder(final Placeholder placeholder, final Document document, final LocalDateTime now) {
        final var shared = document.shared();
        final var metadata = placeholder.metadata();
        final var cell = placeholder.value();
        switch (placeholder.key()) {
            case tocName -> cell.resolve(Listings.tableOfContents(
                document.blocks(),
                metadata != null && metadata.flag(orderedFlag)
            ));
            case dateName -> cell.resolve(new Inline.Plain(dateFormat.format(now)));
            case timeName -> cell.resolve(new Inline.Plain(timeFormat.format(now)));
            case dateTimeName -> cell.resolve(new Inline.Plain(dateFormat.format(now) + ' ' + timeFormat.format(now)));
            case bibliographyName -> cell.resolve(Listings.bibliography(shared.bibliography().citedEntries()));
            case glossaryName -> cell.resolve(Listings.glossary(shared.glossary().usedEntries()));
            default -> {
                final var value = configurationValue(placeholder, shared.configuration());
                if (value != null) {
                    cell.resolve(value);
                } else {
                    cell.markUnresolved("[[" + placeholder.name() + "]]");
                }
            }
        }
    }

    private static @Nullable Element configurationValue(
        final Placeholder placeholder,
        final Configuration configuration
    ) {
        final var value = configuration.get(placeholder.key());
        if (value == null) {
            return null;
        } else if (value instanceof ConfigValue.TemplateValue template) {
            final var metadata = placeholder.metadata();
            final Map<String, Inline> replacements = (metadata == null)
                ? Map.of()
                : TemplateExpander.replacementsFrom(metadata);
            return TemplateExpander.expand(template.template(), replacements);
        } else if (value instanceof ConfigValue.PlaceholderValue other) {
            return new Inline.PlaceholderRef(other.placeholder());
        }
        return new Inline.Plain(value.asText());
    }

    private static final String definitionPrefix = "set:";
    private static final String definitionValue = "value";
    private static final String orderedFlag = "ordered";
    private static final String defaultBibRefDisplay = "{{number}}";
    private static final DateTimeFormatter dateFormat = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final DateTimeFormatter timeFormat = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final Clock clock;
}
