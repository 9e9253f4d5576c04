package com.components.bom;

import com.components.bom.service.core.PackageMatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class BomRankerApplicationTests {

    @Autowired
    private PackageMatcher packageMatcher;

    @Test
    void contextLoadsWithConfiguredPackageAliases() {
        assertThat(packageMatcher.score("SOT-23", "TO-236")).isEqualTo(PackageMatcher.EQUIVALENT);
    }
}
