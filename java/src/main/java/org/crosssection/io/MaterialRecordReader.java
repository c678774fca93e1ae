package org.crosssection.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.crosssection.core.exceptions.InvalidParameterException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads material base data (basedata.json) into {@link MaterialRecord}s. Unknown keys are
 * rejected; {@code Infinity} is accepted as an open upper calibration bound.
 */
public class MaterialRecordReader {

    private final ObjectMapper mapper;

    public MaterialRecordReader() {
        this.mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
    }

    public MaterialRecord read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (NoSuchFileException e) {
            throw new InvalidParameterException("material file not found: " + path, e);
        } catch (IOException e) {
            throw new InvalidParameterException("cannot read material file " + path, e);
        }
    }

    public MaterialRecord read(InputStream in) throws IOException {
        try {
            MaterialRecord record = mapper.readValue(in, MaterialRecord.class);
            if (record == null) {
                throw new InvalidParameterException("material record is empty");
            }
            return record;
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("malformed material record: " + e.getOriginalMessage(), e);
        }
    }
}
