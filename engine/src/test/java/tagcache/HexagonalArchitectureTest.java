package tagcache;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.syntax.ArchRuleDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("tagcache");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tagcache.core..")
                    .should().dependOnClassesThat().resideInAPackage("tagcache.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on spi")
        void coreShouldNotDependOnSpi() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tagcache.core..")
                    .should().dependOnClassesThat().resideInAPackage("tagcache.spi..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on store client libraries")
        void coreShouldNotDependOnStoreClients() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tagcache.core..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "io.quarkus.redis..", "com.github.benmanes.caffeine..");

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
                    .that().resideInAPackage("tagcache.spi..")
                    .should().dependOnClassesThat().resideInAPackage("tagcache.adapter..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("tagcache.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Model Rules")
    class ModelRules {

        @Test
        @DisplayName("Models should not depend on services")
        void modelsShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tagcache.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("tagcache.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tagcache.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("tagcache.core.port..");

            rule.check(importedClasses);
        }
    }
}
