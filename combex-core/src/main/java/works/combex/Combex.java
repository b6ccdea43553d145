package works.combex;

public final class Combex {
	public static final String NAME = "combex";

	private Combex() { }

	/**
	 * @return the implementation version from the jar manifest, or {@code "0.0.0"}
	 * when running from classes that weren't packaged
	 */
	public static String version() {
		String result = Combex.class.getPackage().getImplementationVersion();
		return result == null ? "0.0.0" : result;
	}

	public static String userAgent() {
		return NAME + "/" + version();
	}
}
