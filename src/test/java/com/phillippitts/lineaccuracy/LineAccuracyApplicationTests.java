package com.phillippitts.lineaccuracy;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class LineAccuracyApplicationTests {

    @Test
    void contextLoads() {
    }

}
