package org.genemeta.datapipeline.resources.database;

import java.lang.reflect.Type;
import java.sql.SQLException;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.LedgerEntry;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Serializes the contribution ledger of a sufficient-statistics row to the {@code ledger_json}
 * column. Gson writes doubles with {@link Double#toString(double)}, so values survive a
 * round trip bit for bit.
 */
final class LedgerJsonCodec {

    private static final Type LEDGER_TYPE = new TypeToken<List<LedgerEntry>>() { }.getType();

    private final Gson gson = new Gson();

    String toJson(List<LedgerEntry> ledger) {
        return gson.toJson(ledger, LEDGER_TYPE);
    }

    List<LedgerEntry> fromJson(String json) throws SQLException {
        try {
            List<LedgerEntry> entries = gson.fromJson(json, LEDGER_TYPE);
            return entries != null ? entries : List.of();
        } catch (JsonParseException e) {
            throw new SQLException("Corrupted ledger column: " + e.getMessage(), e);
        }
    }
}
