package com.sashkomusic.catalogreconciler.infrastructure.tag;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sashkomusic.catalogreconciler.domain.exception.TagWriteException;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JaudiotaggerTagWriterTest {

    private final JaudiotaggerTagWriter tagWriter = new JaudiotaggerTagWriter();

    @TempDir
    Path tempDir;

    @Test
    void flacKeepsUntouchedFieldsAndStoresLabelAsOrganization() throws Exception {
        Path flac = copyFixture("silence.flac");

        tagWriter.writeTags(flac, MergedTagSet.builder()
                .genre("Progressive House")
                .bpm(127.6)
                .key("A Minor")
                .label("mau5trap")
                .isrc("USUS10900001")
                .catalogNumber("MAU5021")
                .year(2009)
                .build(), image("png"));

        Tag tag = readBack(flac);
        assertEquals("Strobe", tag.getFirst(FieldKey.TITLE));
        assertEquals("deadmau5", tag.getFirst(FieldKey.ARTIST));
        assertEquals("For Lack of a Better Name", tag.getFirst(FieldKey.ALBUM));
        assertEquals("Progressive House", tag.getFirst(FieldKey.GENRE));
        assertEquals("128", tag.getFirst(FieldKey.BPM));
        assertEquals("A Minor", tag.getFirst(FieldKey.KEY));
        assertEquals("USUS10900001", tag.getFirst(FieldKey.ISRC));
        assertEquals("MAU5021", tag.getFirst(FieldKey.CATALOG_NO));
        assertEquals("2009", tag.getFirst(FieldKey.YEAR));
        assertEquals("mau5trap", tag.getFirst("ORGANIZATION"));
        assertEquals(1, tag.getArtworkList().size());
    }

    @Test
    void flacFrontCoverIsReplacedNotAppended() throws Exception {
        Path flac = copyFixture("silence.flac");

        tagWriter.writeTags(flac, MergedTagSet.builder().artworkUrl("https://img.example/a.jpg").build(), image("jpg"));
        tagWriter.writeTags(flac, MergedTagSet.builder().artworkUrl("https://img.example/b.png").build(), image("png"));

        Tag tag = readBack(flac);
        assertEquals(1, tag.getArtworkList().size());
        assertEquals("image/png", tag.getFirstArtwork().getMimeType());
        assertEquals("Strobe", tag.getFirst(FieldKey.TITLE));
    }

    @Test
    void mp3StoresLabelAsRecordLabelAndKeepsEarlierFields() throws Exception {
        Path mp3 = copyFixture("silence.mp3");

        tagWriter.writeTags(mp3, MergedTagSet.builder()
                .title("Strobe")
                .album("For Lack of a Better Name")
                .build(), image("jpg"));
        tagWriter.writeTags(mp3, MergedTagSet.builder()
                .bpm(126.4)
                .key("A Minor")
                .label("mau5trap")
                .year(2009)
                .build(), image("png"));

        Tag tag = readBack(mp3);
        assertEquals("Strobe", tag.getFirst(FieldKey.TITLE));
        assertEquals("For Lack of a Better Name", tag.getFirst(FieldKey.ALBUM));
        assertEquals("126", tag.getFirst(FieldKey.BPM));
        assertEquals("A Minor", tag.getFirst(FieldKey.KEY));
        assertEquals("2009", tag.getFirst(FieldKey.YEAR));
        assertEquals("mau5trap", tag.getFirst(FieldKey.RECORD_LABEL));
        assertEquals(1, tag.getArtworkList().size());
        assertEquals("image/png", tag.getFirstArtwork().getMimeType());
    }

    @Test
    void missingFileCannotBeTagged() {
        Path missing = tempDir.resolve("missing.mp3");

        TagWriteException ex = assertThrows(TagWriteException.class,
                () -> tagWriter.writeTags(missing, MergedTagSet.builder().genre("Techno").build(), null));
        assertTrue(ex.getMessage().contains("missing.mp3"));
    }

    @Test
    void unsupportedFormatCannotBeTagged() throws IOException {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "not audio");

        assertThrows(TagWriteException.class,
                () -> tagWriter.writeTags(notes, MergedTagSet.builder().bpm(128.0).build(), null));
    }

    @Test
    void corruptAudioCannotBeTagged() throws IOException {
        Path corrupt = Files.write(tempDir.resolve("corrupt.flac"), new byte[]{0x00, 0x01, 0x02, 0x03});

        assertThrows(TagWriteException.class,
                () -> tagWriter.writeTags(corrupt, MergedTagSet.builder().genre("Techno").build(), null));
    }

    @Test
    void nullPathIsRejected() {
        assertThrows(TagWriteException.class,
                () -> tagWriter.writeTags(null, MergedTagSet.builder().genre("Techno").build(), null));
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/audio/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    private static Tag readBack(Path file) throws Exception {
        return AudioFileIO.read(file.toFile()).getTag();
    }

    private static byte[] image(String format) throws IOException {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, format, out);
        return out.toByteArray();
    }
}
