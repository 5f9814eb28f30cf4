package appauth.core.model.storage;

import java.util.List;

/**
 * One page of a cursor-based key scan.
 *
 * @param cursor cursor for the next page; {@link #START} when the scan is finished
 * @param keys keys returned in this page (may be empty even when the scan continues)
 */
public record ScanPage(String cursor, List<String> keys) {

    public static final String START = "0";

    public ScanPage {
        keys = List.copyOf(keys);
    }

    public boolean isLast() {
        return START.equals(cursor);
    }
}
