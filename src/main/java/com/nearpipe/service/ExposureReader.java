package com.nearpipe.service;

import com.nearpipe.model.RawExposure;
import java.io.IOException;
import java.nio.file.Path;

public interface ExposureReader {
    RawExposure read(Path file) throws IOException;
}
