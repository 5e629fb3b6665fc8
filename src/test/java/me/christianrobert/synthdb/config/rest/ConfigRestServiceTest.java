package me.christianrobert.synthdb.config.rest;

import me.christianrobert.synthdb.config.service.ConfigService;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigRestServiceTest {

    @Test
    void testValidate() {
        assertNull(ConfigRestService.validate(ConfigService.ROWS_PER_TABLE, 10));
        assertNull(ConfigRestService.validate(ConfigService.ROWS_PER_TABLE, "10"));
        assertNotNull(ConfigRestService.validate(ConfigService.ROWS_PER_TABLE, 0));
        assertNotNull(ConfigRestService.validate(ConfigService.SOURCE_SAMPLE_LIMIT, "many"));
        assertNull(ConfigRestService.validate(ConfigService.SEED, ""));
        assertNull(ConfigRestService.validate(ConfigService.SEED, "-5"));
        assertNotNull(ConfigRestService.validate(ConfigService.SEED, "abc"));
        assertNotNull(ConfigRestService.validate(ConfigService.OUTPUT_PATH, null));
    }
}
