package io.github.cyfko.partialresponse.core;

import io.github.cyfko.partialresponse.core.api.SelectorParser;
import io.github.cyfko.partialresponse.core.config.PartialResponseConfig;
import io.github.cyfko.partialresponse.core.impl.BasicSelectorParser;
import io.github.cyfko.partialresponse.core.model.FieldsResolution;
import io.github.cyfko.partialresponse.core.model.ParseResult;
import io.github.cyfko.partialresponse.core.model.Selection;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for hosts: turns the raw selector of a request into a {@link FieldsResolution} according to the
 * configured error policy.
 *
 * <pre>{@code
 * PartialResponse partialResponse = PartialResponse.of(PartialResponseConfig.builder()
 *     .ignoreCase(true)
 *     .build());
 *
 * FieldsResolution fields = partialResponse.resolve(request.getParameter("fields"));
 * if (fields.isRejected()) {
 *     response.setStatus(400);
 *     return;
 * }
 * writer.writeValue(out, body, fields);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; one per application is enough.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PartialResponse {

    private static final Logger logger = Logger.getLogger(PartialResponse.class.getName());

    private final PartialResponseConfig config;
    private final SelectorParser parser;

    private PartialResponse(PartialResponseConfig config, SelectorParser parser) {
        this.config = config;
        this.parser = parser;
    }

    public static PartialResponse defaults() {
        return of(PartialResponseConfig.defaults());
    }

    public static PartialResponse of(PartialResponseConfig config) {
        Objects.requireNonNull(config, "config");
        return new PartialResponse(config, new BasicSelectorParser(config.getSelectorPolicy(), config.getCachePolicy()));
    }

    /**
     * @param config the host configuration
     * @param parser the parser to use instead of the default {@link BasicSelectorParser}
     */
    public static PartialResponse of(PartialResponseConfig config, SelectorParser parser) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(parser, "parser");
        return new PartialResponse(config, parser);
    }

    public PartialResponseConfig config() {
        return config;
    }

    /**
     * Resolves the selector of one request.
     *
     * @param rawFields the selector as received, {@code null} if the client sent none
     * @return the action the host must take
     */
    public FieldsResolution resolve(String rawFields) {
        if (rawFields == null) {
            return FieldsResolution.serializeAll(null);
        }

        ParseResult result = parser.parse(rawFields);
        if (result.isError()) {
            ParseResult.Error error = result.error().orElseThrow();
            if (config.isIgnoreParseErrors()) {
                logger.fine(() -> "Ignoring malformed fields selector '" + rawFields + "': " + error.message());
                return FieldsResolution.serializeAll(error);
            }
            logger.fine(() -> "Rejecting malformed fields selector '" + rawFields + "': " + error.message());
            return FieldsResolution.reject(error);
        }

        Selection selection = result.selection().orElse(Selection.empty());
        if (selection.isEmpty()) {
            return FieldsResolution.serializeAll(null);
        }
        return FieldsResolution.filter(selection, config.isIgnoreCase());
    }
}
