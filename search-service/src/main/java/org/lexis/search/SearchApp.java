package org.lexis.search;

import org.lexis.search.bootstrap.SearchBootstrap;

public class SearchApp {
    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
