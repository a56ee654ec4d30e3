package com.spiderjobs.crawl.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ParserRegistry {
    private static final Logger log = LoggerFactory.getLogger(ParserRegistry.class);

    private final Map<String, ListingParser> parsers = new ConcurrentHashMap<>();

    public ParserRegistry(List<ListingParser> parsers) {
        for (ListingParser parser : parsers) {
            register(parser);
        }
    }

    public void register(ListingParser parser) {
        ListingParser previous = parsers.put(parser.id(), parser);
        if (previous != null && previous != parser) {
            log.warn("Parser {} replaced {} with {}", parser.id(),
                previous.getClass().getSimpleName(), parser.getClass().getSimpleName());
        }
    }

    public Optional<ListingParser> resolve(String parserId) {
        if (parserId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(parsers.get(parserId));
    }

    public Set<String> parserIds() {
        return Set.copyOf(parsers.keySet());
    }
}
