package appauth;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("appauth");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("appauth.core..")
                    .should().dependOnClassesThat().resideInAPackage("appauth.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on application wiring")
        void coreShouldNotDependOnConfig() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("appauth.core..")
                    .should().dependOnClassesThat().resideInAPackage("appauth.config..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not talk to Redis directly")
        void coreShouldNotDependOnRedisClient() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("appauth.core..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.quarkus.redis..", "io.vertx..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter")
        void spiShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("appauth.spi..")
                    .should().dependOnClassesThat().resideInAPackage("appauth.adapter..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Inbound adapters should not depend on outbound adapters")
        void inboundShouldNotDependOnOutbound() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("appauth.adapter.in..")
                    .should().dependOnClassesThat().resideInAPackage("appauth.adapter.out..");

            rule.check(importedClasses);
        }
    }
}
