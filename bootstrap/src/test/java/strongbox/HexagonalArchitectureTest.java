package strongbox;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("strongbox");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("strongbox.core..")
                    .should().dependOnClassesThat().resideInAPackage("strongbox.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on the HTTP client")
        void coreShouldNotDependOnVertx() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("strongbox.core..")
                    .should().dependOnClassesThat().resideInAPackage("io.vertx..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on JSON serialization")
        void coreShouldNotDependOnJackson() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("strongbox.core..")
                    .should().dependOnClassesThat().resideInAPackage("com.fasterxml..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Rules")
    class PortRules {

        @Test
        @DisplayName("Outbound ports should be interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("strongbox.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should be interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = classes()
                    .that().resideInAPackage("strongbox.core.port.in..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Outbound adapters should not depend on inbound adapters")
        void outboundAdaptersShouldNotDependOnInbound() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("strongbox.adapter.out..")
                    .should().dependOnClassesThat().resideInAPackage("strongbox.adapter.in..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Adapters should not depend on core services")
        void adaptersShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("strongbox.adapter.out..")
                    .should().dependOnClassesThat().resideInAPackage("strongbox.core.service..");

            rule.check(importedClasses);
        }
    }
}
