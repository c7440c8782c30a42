package com.nearpipe;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class NearPipeline {
    public static final String ID = "near-pipeline";
    public static final String NAME = "NEAR Pipeline";
    public static final Logger LOGGER = LogManager.getLogger(ID);

    private NearPipeline() {}
}
