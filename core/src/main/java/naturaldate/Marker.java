package naturaldate;

/**
 * Lives in the root package so Weld can scan every bean below it, including beans packaged in another JAR.
 */
public class Marker {
}
