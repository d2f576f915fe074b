package com.largomodo.palletquote.service;

import com.largomodo.palletquote.core.domain.Dimensions;
import com.largomodo.palletquote.core.domain.LengthUnit;
import com.largomodo.palletquote.core.domain.Product;
import com.largomodo.palletquote.core.domain.ProductRequest;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads product requests from a comma-separated file.
 * <p>
 * The first non-blank line is the header; columns are matched by name
 * (case-insensitive) so their order is free. Required columns:
 * {@code id,name,sku,length,width,height,unit,weight,quantity}.
 * Fields may be double-quoted; a doubled quote inside a quoted field is a literal quote.
 * <p>
 * The reader only rejects rows it cannot represent at all (wrong column count,
 * non-numeric values). Incomplete catalog data is passed through for the validator:
 * blank dimension cells give a product without dimensions, an unknown unit gives
 * dimensions without a unit, a blank weight gives a product without weight.
 * Blank lines and lines starting with {@code #} are skipped.
 */
public class ProductCsvReader {

    static final List<String> COLUMNS = List.of(
            "id", "name", "sku", "length", "width", "height", "unit", "weight", "quantity");

    public List<ProductRequest> read(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new ProductFileFormatException("Not a readable file: " + file, 0);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<ProductRequest> read(BufferedReader reader) throws IOException {
        Map<String, Integer> header = null;
        List<ProductRequest> requests = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank() || line.stripLeading().startsWith("#")) {
                continue;
            }
            List<String> fields = split(line, lineNumber);
            if (header == null) {
                header = parseHeader(fields, lineNumber);
                continue;
            }
            if (fields.size() != header.size()) {
                throw new ProductFileFormatException(
                        "expected " + header.size() + " fields but found " + fields.size(), lineNumber);
            }
            requests.add(parseRow(fields, header, lineNumber));
        }
        if (header == null) {
            throw new ProductFileFormatException("File is empty (no header line)", 0);
        }
        return requests;
    }

    private Map<String, Integer> parseHeader(List<String> fields, int lineNumber) throws ProductFileFormatException {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            String name = fields.get(i).trim().toLowerCase(Locale.ROOT);
            if (header.putIfAbsent(name, i) != null) {
                throw new ProductFileFormatException("duplicate column '" + name + "' in header", lineNumber);
            }
        }
        for (String column : COLUMNS) {
            if (!header.containsKey(column)) {
                throw new ProductFileFormatException("missing column '" + column + "' in header", lineNumber);
            }
        }
        return header;
    }

    private ProductRequest parseRow(List<String> fields, Map<String, Integer> header, int lineNumber)
            throws ProductFileFormatException {
        String length = cell(fields, header, "length");
        String width = cell(fields, header, "width");
        String height = cell(fields, header, "height");

        Dimensions dimensions = null;
        if (!(length.isEmpty() && width.isEmpty() && height.isEmpty())) {
            LengthUnit unit = LengthUnit.fromSymbol(cell(fields, header, "unit")).orElse(null);
            dimensions = new Dimensions(
                    number(length, "length", lineNumber),
                    number(width, "width", lineNumber),
                    number(height, "height", lineNumber),
                    unit);
        }

        String weightCell = cell(fields, header, "weight");
        Double weight = weightCell.isEmpty() ? null : number(weightCell, "weight", lineNumber);

        String quantityCell = cell(fields, header, "quantity");
        int quantity;
        try {
            quantity = Integer.parseInt(quantityCell);
        } catch (NumberFormatException e) {
            throw new ProductFileFormatException("quantity is not an integer: '" + quantityCell + "'", lineNumber, e);
        }

        Product product = new Product(
                blankToNull(cell(fields, header, "id")),
                blankToNull(cell(fields, header, "name")),
                blankToNull(cell(fields, header, "sku")),
                dimensions,
                weight);
        return new ProductRequest(product, quantity);
    }

    private static String cell(List<String> fields, Map<String, Integer> header, String column) {
        return fields.get(header.get(column)).trim();
    }

    private static double number(String value, String column, int lineNumber) throws ProductFileFormatException {
        if (value.isEmpty()) {
            throw new ProductFileFormatException(column + " is blank while other dimensions are set", lineNumber);
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ProductFileFormatException(column + " is not a number: '" + value + "'", lineNumber, e);
        }
    }

    private static String blankToNull(String value) {
        return value.isEmpty() ? null : value;
    }

    static List<String> split(String line, int lineNumber) throws ProductFileFormatException {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new ProductFileFormatException("unterminated quoted field", lineNumber);
        }
        fields.add(current.toString());
        return fields;
    }
}
