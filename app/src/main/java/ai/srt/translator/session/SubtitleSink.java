package ai.srt.translator.session;

import java.io.IOException;

/**
 * Destination for serialized subtitle text, typically a file chosen by the user.
 */
@FunctionalInterface
public interface SubtitleSink {

    void write(String content) throws IOException;
}
