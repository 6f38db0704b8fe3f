package typesafeschwalbe.lunac.compiler;

import java.util.Map;

public record Source(String file, int line, int column) {

    public static final Source NONE = new Source("<generated>", 0, 0);

    public boolean isSynthetic() {
        return this.line <= 0;
    }

    public String lineText(Map<String, String> files) {
        String content = files.get(this.file);
        if(content == null || this.isSynthetic()) { return null; }
        int lineI = 1;
        int start = 0;
        while(lineI < this.line) {
            int next = content.indexOf('\n', start);
            if(next == -1) { return null; }
            start = next + 1;
            lineI += 1;
        }
        int end = content.indexOf('\n', start);
        if(end == -1) {
            end = content.length();
        }
        String text = content.substring(start, end);
        if(text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }

    @Override
    public String toString() {
        return this.file + ":" + this.line + ":" + this.column;
    }

}
