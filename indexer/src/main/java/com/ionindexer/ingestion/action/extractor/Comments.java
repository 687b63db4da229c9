package com.ionindexer.ingestion.action.extractor;

final class Comments {

    private Comments() {
    }

    /** Removes NUL characters some wallets pad comments with. */
    static String stripNulls(String comment) {
        return comment.replace("\u0000", "");
    }
}
