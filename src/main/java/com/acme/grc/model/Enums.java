package com.acme.grc.model;

public final class Enums {
    private Enums() {}
    public enum Severity { OK, WARN, ERROR }
    public enum ComplianceState { COMPLIANT, NON_COMPLIANT, UNEVALUATED }
    public enum DbType { AUTO, ANSI, ORACLE, DB2, SQLSERVER, POSTGRES, UNKNOWN }
    public enum FieldMode { KEY, REQUIRED, NULLABLE }
    public enum FieldType { TEXT, NUMBER, BOOLEAN, TIMESTAMP }
    public enum JoinStrategy { SINGLE, UNION, JOIN, SEPARATE, NONE }
    public enum QueryKind { SELECTION, SUMMARY }
}
