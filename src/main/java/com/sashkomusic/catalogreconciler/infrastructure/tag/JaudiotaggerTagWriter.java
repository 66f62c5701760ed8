package com.sashkomusic.catalogreconciler.infrastructure.tag;

import com.sashkomusic.catalogreconciler.domain.exception.TagWriteException;
import com.sashkomusic.catalogreconciler.domain.model.MergedTagSet;
import com.sashkomusic.catalogreconciler.domain.port.TagWriterPort;
import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.flac.FlacTag;
import org.jaudiotagger.tag.id3.valuepair.ImageFormats;
import org.jaudiotagger.tag.images.Artwork;
import org.jaudiotagger.tag.images.ArtworkFactory;
import org.jaudiotagger.tag.reference.PictureTypes;
import org.jaudiotagger.tag.vorbiscomment.VorbisCommentTag;
import org.jaudiotagger.tag.vorbiscomment.VorbisCommentTagField;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes merged catalog tags into audio files. Only the populated fields of a {@link MergedTagSet}
 * are touched; everything else in the file is left as it is.
 */
@Slf4j
@Component
public class JaudiotaggerTagWriter implements TagWriterPort {

    private static final String VORBIS_LABEL = "ORGANIZATION";

    @Override
    public void writeTags(Path audioFile, MergedTagSet tags, byte[] artwork) {
        requireFile(audioFile);

        try {
            AudioFile f = AudioFileIO.read(audioFile.toFile());
            Tag tag = f.getTagOrCreateAndSetDefault();

            log.debug("Writing {} to {}", tags.changedFields(), audioFile.getFileName());

            setIfPresent(tag, FieldKey.TITLE, tags.title());
            setIfPresent(tag, FieldKey.ARTIST, tags.artist());
            setIfPresent(tag, FieldKey.ALBUM, tags.album());
            setIfPresent(tag, FieldKey.GENRE, tags.genre());
            setIfPresent(tag, FieldKey.KEY, tags.key());
            setIfPresent(tag, FieldKey.ISRC, tags.isrc());
            setIfPresent(tag, FieldKey.CATALOG_NO, tags.catalogNumber());

            if (tags.bpm() != null) {
                tag.setField(FieldKey.BPM, String.valueOf(Math.round(tags.bpm())));
            }
            if (tags.year() != null) {
                tag.setField(FieldKey.YEAR, String.valueOf(tags.year()));
            }
            if (tags.label() != null) {
                setLabel(tag, tags.label());
            }

            if (artwork != null && artwork.length > 0) {
                tag.deleteArtworkField();
                tag.setField(frontCover(artwork));
                log.debug("Embedded front cover ({} bytes)", artwork.length);
            }

            f.commit();
            log.info("Tags written: {}", audioFile.getFileName());

        } catch (Exception ex) {
            log.error("Error tagging file {}: {}", audioFile.getFileName(), ex.getMessage());
            throw new TagWriteException("Failed to write tags to " + audioFile.getFileName() + ": " + ex.getMessage(), ex);
        }
    }

    private void requireFile(Path audioFile) {
        if (audioFile == null) {
            throw new TagWriteException("No audio file given");
        }
        if (!Files.isRegularFile(audioFile)) {
            throw new TagWriteException("Audio file not found: " + audioFile);
        }
    }

    private void setIfPresent(Tag tag, FieldKey key, String value) throws Exception {
        if (value != null && !value.isEmpty()) {
            tag.setField(key, value);
        }
    }

    private void setLabel(Tag tag, String label) throws Exception {
        if (tag instanceof FlacTag || tag instanceof VorbisCommentTag) {
            tag.setField(new VorbisCommentTagField(VORBIS_LABEL, label));
        } else {
            tag.setField(FieldKey.RECORD_LABEL, label);
        }
    }

    private Artwork frontCover(byte[] imageData) {
        Artwork artwork = ArtworkFactory.getNew();
        artwork.setBinaryData(imageData);
        artwork.setMimeType(ImageFormats.getMimeTypeForBinarySignature(imageData));
        artwork.setPictureType(PictureTypes.DEFAULT_ID);
        return artwork;
    }
}
