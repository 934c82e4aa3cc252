package work.hostcheck.engine.provider;

final class ShellQuote {
    private ShellQuote() {}

    static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
