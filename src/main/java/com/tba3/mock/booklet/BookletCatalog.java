package com.tba3.mock.booklet;

import com.tba3.mock.booklet.BookletModels.Booklet;

import java.util.*;

public final class BookletCatalog {
    private final Map<BookletKey, Booklet> booklets;

    public BookletCatalog(Map<BookletKey, Booklet> booklets) {
        this.booklets = Collections.unmodifiableMap(new LinkedHashMap<>(booklets));
    }

    public static BookletCatalog empty() {
        return new BookletCatalog(Map.of());
    }

    public Optional<Booklet> get(BookletKey key) {
        return Optional.ofNullable(booklets.get(key));
    }

    public Set<BookletKey> keys() {
        return booklets.keySet();
    }

    public int size() {
        return booklets.size();
    }
}
