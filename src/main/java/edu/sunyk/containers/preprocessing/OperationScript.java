package edu.sunyk.containers.preprocessing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.apache.log4j.Logger;

/**
 * Reads operation scripts: CSV files with one tree operation per row, e.g.
 * <pre>
 * # build and check
 * insert,10,ten
 * insert,20,twenty
 * delete,10
 * find,20
 * validate
 * </pre>
 * Blank rows and rows starting with {@code #} are skipped. Keys go through the
 * key parser handed to the constructor; values stay strings.
 */
public class OperationScript<K extends Comparable<K>> {
    private static final Logger LOG = Logger.getLogger(OperationScript.class);

    private final Function<String, K> keyParser;

    public OperationScript(Function<String, K> keyParser) {
        this.keyParser = checkNotNull(keyParser, "keyParser");
    }

    public List<Operation<K>> read(String path) throws IOException {
        try(Reader in = new FileReader(path)) {
            List<Operation<K>> ops = read(in);
            LOG.info("read " + ops.size() + " operations from " + path);
            return ops;
        }
    }

    public List<Operation<K>> read(Reader in) throws IOException {
        List<Operation<K>> ops = new ArrayList<>();
        CSVReader csv = new CSVReader(in);
        String[] row;
        while((row = next(csv)) != null) {
            long line = csv.getLinesRead();
            if(isBlank(row) || row[0].trim().startsWith("#"))
                continue;
            ops.add(parse(trimTrailingEmpty(row), line));
        }
        return ops;
    }

    private String[] next(CSVReader csv) throws IOException {
        try {
            return csv.readNext();
        } catch(CsvValidationException e) {
            throw new ScriptFormatException(csv.getLinesRead(), "unreadable row", e);
        }
    }

    private Operation<K> parse(String[] row, long line) throws ScriptFormatException {
        Operation.Kind kind;
        try {
            kind = Operation.Kind.parse(row[0]);
        } catch(IllegalArgumentException e) {
            throw new ScriptFormatException(line, "unknown operation '" + row[0].trim() + "'", e);
        }
        if(row.length != kind.cells())
            throw new ScriptFormatException(line, kind + " takes " + (kind.cells() - 1)
                                                  + " argument(s), got " + (row.length - 1));

        K key = null;
        String value = null;
        if(kind.cells() >= 2) {
            String text = row[1].trim();
            try {
                key = keyParser.apply(text);
            } catch(RuntimeException e) {
                throw new ScriptFormatException(line, "bad key '" + text + "'", e);
            }
            if(key == null)
                throw new ScriptFormatException(line, "bad key '" + text + "'");
        }
        if(kind.cells() == 3)
            value = row[2].trim();
        return new Operation<>(kind, key, value, line);
    }

    private static boolean isBlank(String[] row) {
        for(String cell : row) {
            if(!cell.trim().isEmpty())
                return false;
        }
        return true;
    }

    private static String[] trimTrailingEmpty(String[] row) {
        int n = row.length;
        while(n > 1 && row[n - 1].trim().isEmpty())
            n--;
        if(n == row.length)
            return row;
        String[] trimmed = new String[n];
        System.arraycopy(row, 0, trimmed, 0, n);
        return trimmed;
    }
}
