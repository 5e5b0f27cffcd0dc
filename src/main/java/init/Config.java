package init;

public class Config {

    // Basic Config
    public static String logLevel = "WARN";

    // Skolemizer Config
    public static boolean flattenIte = true;
    public static boolean flattenIff = true;
    public static String skolemPrefix = "skolem";

    // Value Table Config
    // -1 keeps every known value in enumeration constraints
    public static int enumerationBound = -1;
    public static boolean acceptFunctionDefaults = true;

    // Path Config
    public static boolean dumpValueTable = false;
    public static String valueTableDumpPath = "output/ef_value_table.json";
}
