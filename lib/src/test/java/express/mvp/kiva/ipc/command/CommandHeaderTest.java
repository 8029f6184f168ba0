package express.mvp.kiva.ipc.command;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.kiva.ipc.command.CommandHeader.Scan;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Unit tests for {@link CommandHeader} and {@link Command}.
 */
@DisplayName("CommandHeader")
class CommandHeaderTest {

    private static ByteBuffer ascii(String text) {
        return ByteBuffer.wrap(text.getBytes(StandardCharsets.US_ASCII));
    }

    @Nested
    @DisplayName("Encoding")
    class EncodingTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "PING, @IPC0001",
            "PONG, @IPC0002",
            "SET_STREAM, @IPC0003",
            "SET_DATA, @IPC0004"
        })
        @DisplayName("Encodes magic plus a four-digit code")
        void encodes(Command command, String expected) {
            byte[] header = CommandHeader.encode(command);

            assertEquals(CommandHeader.WIDTH, header.length);
            assertEquals(expected, new String(header, StandardCharsets.US_ASCII));
        }

        @ParameterizedTest
        @EnumSource(Command.class)
        @DisplayName("Codes map back to commands")
        void codesRoundTrip(Command command) {
            assertEquals(command, Command.fromCode(command.code()));
        }

        @Test
        @DisplayName("Unknown codes map to null")
        void unknownCode() {
            assertNull(Command.fromCode(0));
            assertNull(Command.fromCode(9999));
        }
    }

    @Nested
    @DisplayName("Probing")
    class ScanTests {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
            "'', PARTIAL",
            "@, PARTIAL",
            "@IP, PARTIAL",
            "@IPC, PARTIAL",
            "@IPC000, PARTIAL",
            "@IPC0001, MATCH",
            "@IPC0004trailing, MATCH",
            "hello, NO_MATCH",
            "@IPX0001, NO_MATCH",
            "@IPC0009, NO_MATCH",
            "@IPC1, NO_MATCH",
            "@IPC00x1, NO_MATCH"
        })
        @DisplayName("Classifies the leading bytes")
        void scans(String input, Scan expected) {
            assertEquals(expected, CommandHeader.scan(ascii(input)));
        }

        @Test
        @DisplayName("Does not consume the buffer")
        void doesNotConsume() {
            ByteBuffer buffer = ascii("@IPC0001");

            CommandHeader.scan(buffer);

            assertEquals(0, buffer.position());
        }

        @Test
        @DisplayName("Respects the buffer position")
        void respectsPosition() {
            ByteBuffer buffer = ascii("xx@IPC0002");
            buffer.position(2);

            assertEquals(Scan.MATCH, CommandHeader.scan(buffer));
        }
    }

    @Nested
    @DisplayName("Decoding")
    class DecodeTests {

        @Test
        @DisplayName("Consumes exactly one header")
        void consumesOneHeader() {
            ByteBuffer buffer = ascii("@IPC0003@IPC0001");

            assertEquals(Command.SET_STREAM, CommandHeader.decode(buffer));
            assertEquals(CommandHeader.WIDTH, buffer.position());
            assertEquals(Command.PING, CommandHeader.decode(buffer));
            assertFalse(buffer.hasRemaining());
        }

        @Test
        @DisplayName("Rejects payload bytes")
        void rejectsPayload() {
            assertThrows(IllegalArgumentException.class,
                    () -> CommandHeader.decode(ascii("not a header")));
        }

        @Test
        @DisplayName("Rejects an incomplete header")
        void rejectsIncomplete() {
            assertThrows(IllegalArgumentException.class,
                    () -> CommandHeader.decode(ascii("@IPC00")));
        }
    }
}
