package com.flowhouse.query;

/**
 * Thrown when a result column has a ClickHouse type the series pivot cannot render
 */
public class UnsupportedColumnTypeException extends QueryExecutionException {

    private static final long serialVersionUID = 1L;

    private final String column;
    private final String typeName;

    public UnsupportedColumnTypeException(String column, String typeName) {
        super(String.format("Unsupported type %s for column %s", typeName, column));
        this.column = column;
        this.typeName = typeName;
    }

    public String getColumn() {
        return column;
    }

    public String getTypeName() {
        return typeName;
    }
}
