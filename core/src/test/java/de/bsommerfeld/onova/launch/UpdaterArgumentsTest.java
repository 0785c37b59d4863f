package de.bsommerfeld.onova.launch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdaterArgumentsTest {

    private static final Path UPDATEE = Path.of("/opt/My App/MyApp.jar");
    private static final Path CONTENT = Path.of("/home/user/.local/share/Onova/MyApp/1.2.0.0");

    @Test
    void toArgumentList_shouldProduceFivePositionalArguments() {
        var arguments = new UpdaterArguments(UPDATEE, CONTENT, true, "--x", List.of());

        List<String> list = arguments.toArgumentList();

        assertEquals(UpdaterArguments.ARGUMENT_COUNT, list.size());
        assertEquals(UPDATEE.toString(), list.get(0));
        assertEquals(CONTENT.toString(), list.get(1));
        assertEquals("true", list.get(2));
    }

    @Test
    void parse_shouldRestoreRoutedArgumentsByteForByte() {
        String routed = "--file \"C:\\My Docs\\a b.txt\" --name='x y' \\\"edge\\\" ümlaut";
        var original = new UpdaterArguments(UPDATEE, CONTENT, false, routed, List.of(Path.of("/opt/My App/helper")));

        var parsed = UpdaterArguments.parse(original.toArgumentList().toArray(new String[0]));

        assertEquals(original, parsed);
        assertEquals(routed, parsed.routedArguments());
    }

    @Test
    void parse_shouldRoundTripThroughSingleCommandLine() {
        var original = new UpdaterArguments(UPDATEE, CONTENT, true, "a \"b c\" d",
                List.of(Path.of("/opt/My App/helper"), Path.of("/opt/other/launcher")));

        List<String> split = CommandLine.split(original.toCommandLine());
        var parsed = UpdaterArguments.parse(split.toArray(new String[0]));

        assertEquals(original, parsed);
    }

    @Test
    void parse_shouldAcceptEmptyPayloads() {
        var original = new UpdaterArguments(UPDATEE, CONTENT, false, null, null);

        var parsed = UpdaterArguments.parse(original.toArgumentList().toArray(new String[0]));

        assertEquals("", parsed.routedArguments());
        assertTrue(parsed.additionalExecutables().isEmpty());
    }

    @Test
    void parse_shouldAcceptRestartFlagInAnyCase() {
        String empty = UpdaterArguments.encode("");
        var parsed = UpdaterArguments.parse(new String[] { "a", "b", "TRUE", empty, empty });
        assertTrue(parsed.restart());
    }

    @Test
    void parse_shouldRejectWrongArgumentCount() {
        assertThrows(IllegalArgumentException.class,
                () -> UpdaterArguments.parse(new String[] { "a", "b", "true" }));
    }

    @Test
    void parse_shouldRejectInvalidRestartFlag() {
        String empty = UpdaterArguments.encode("");
        assertThrows(IllegalArgumentException.class,
                () -> UpdaterArguments.parse(new String[] { "a", "b", "yes", empty, empty }));
    }

    @Test
    void parse_shouldRejectInvalidBase64() {
        assertThrows(IllegalArgumentException.class,
                () -> UpdaterArguments.parse(new String[] { "a", "b", "true", "%%%", "" }));
    }

    @Test
    void encode_shouldUseUtf8Base64() {
        assertEquals("aMOk", UpdaterArguments.encode("hä"));
        assertEquals("hä", UpdaterArguments.decode("aMOk"));
    }
}
