package com.pivotbot.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.exception.TradeStatePersistenceException;
import com.pivotbot.backend.model.DailyTradeState;
import com.pivotbot.backend.service.util.AtomicFileWriter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * JSON file holding the {@link DailyTradeState}. Writes replace the file atomically.
 */
@Component
public class TradeStateStore {

    private final ObjectMapper objectMapper;
    private final Path stateFile;

    @Autowired
    public TradeStateStore(ObjectMapper objectMapper, TradingProperties properties) {
        this(objectMapper, Paths.get(properties.getStateFile()));
    }

    public TradeStateStore(ObjectMapper objectMapper, Path stateFile) {
        this.objectMapper = objectMapper;
        this.stateFile = stateFile;
    }

    public Path getStateFile() {
        return stateFile;
    }

    /**
     * @return the stored state, or empty when no state file exists yet
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public Optional<DailyTradeState> load() throws IOException {
        if (!Files.exists(stateFile)) {
            return Optional.empty();
        }
        DailyTradeState state = objectMapper.readValue(stateFile.toFile(), DailyTradeState.class);
        if (state == null) {
            throw new IOException("Trade state file " + stateFile + " holds no state");
        }
        return Optional.of(state);
    }

    public void save(DailyTradeState state) throws TradeStatePersistenceException {
        try {
            AtomicFileWriter.write(stateFile, objectMapper.writeValueAsString(state));
        } catch (IOException e) {
            throw new TradeStatePersistenceException("Could not write trade state to " + stateFile, e);
        }
    }
}
