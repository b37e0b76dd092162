package com.gutenberg.catalog.service.query;

import com.gutenberg.catalog.config.PaginationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw list-endpoint query parameters into a {@link BookListRequest}.
 *
 * <p>Every recognised filter is a comma-separated list. Parsing is lenient: blank or
 * malformed tokens are dropped, a filter left without tokens is absent, and invalid
 * {@code page}/{@code page_size} values fall back to their defaults. Nothing here throws
 * for user input.
 */
@Component
@RequiredArgsConstructor
public class BookFilterParser {

    public static final String GUTENBERG_ID = "gutenberg_id";
    public static final String LANGUAGE = "language";
    public static final String TOPIC = "topic";
    public static final String MIME_TYPE = "mime_type";
    public static final String AUTHOR = "author";
    public static final String TITLE = "title";
    public static final String PAGE = "page";
    public static final String PAGE_SIZE = "page_size";

    private static final int DEFAULT_PAGE = 1;
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final PaginationProperties paginationProperties;

    public BookListRequest parse(Map<String, String> params) {
        BookFilter filter = new BookFilter(
            gutenbergIds(params.get(GUTENBERG_ID)),
            tokens(params.get(LANGUAGE)).stream()
                .map(code -> code.toLowerCase(Locale.ROOT))
                .distinct()
                .toList(),
            tokens(params.get(TOPIC)),
            tokens(params.get(MIME_TYPE)),
            tokens(params.get(AUTHOR)),
            tokens(params.get(TITLE))
        );

        int page = positiveInt(params.get(PAGE)).orElse(DEFAULT_PAGE);
        int pageSize = positiveInt(params.get(PAGE_SIZE))
            .map(size -> Math.min(size, paginationProperties.getMaxPageSize()))
            .orElse(paginationProperties.getDefaultPageSize());

        return new BookListRequest(filter, new PageSelection(page, pageSize));
    }

    List<String> tokens(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(token -> !token.isEmpty())
            .distinct()
            .toList();
    }

    private List<Integer> gutenbergIds(String raw) {
        return tokens(raw).stream()
            .map(this::positiveOrZeroInt)
            .flatMap(Optional::stream)
            .distinct()
            .toList();
    }

    private Optional<Integer> positiveInt(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return positiveOrZeroInt(raw.trim()).filter(value -> value > 0);
    }

    private Optional<Integer> positiveOrZeroInt(String token) {
        if (!DIGITS.matcher(token).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(token));
        } catch (NumberFormatException overflow) {
            // digits only, so the value is out of int range: treat as malformed
            return Optional.empty();
        }
    }
}
