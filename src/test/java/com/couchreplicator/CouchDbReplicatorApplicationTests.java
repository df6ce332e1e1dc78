package com.couchreplicator;

import com.couchreplicator.runner.ReplicatorCommandLineRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(args = "--help")
class CouchDbReplicatorApplicationTests {

    @Autowired
    private ReplicatorCommandLineRunner replicatorCommandLineRunner;

    @Test
    void contextLoads() {
        assertEquals(0, replicatorCommandLineRunner.getExitCode());
    }

}
