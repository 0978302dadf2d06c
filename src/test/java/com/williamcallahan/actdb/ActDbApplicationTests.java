package com.williamcallahan.actdb;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "app.storage.root=target/test-db",
        "app.fixups.dir=target/test-fixups"
})
class ActDbApplicationTests {

    @Test
    void contextLoads() {
    }

}
