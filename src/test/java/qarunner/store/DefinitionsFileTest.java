package qarunner.store;

import org.testng.annotations.Test;
import qarunner.model.ApiCheck;
import qarunner.model.BrowserEngine;
import qarunner.model.RetryPolicy;
import qarunner.model.Schedule;
import qarunner.model.TestType;
import qarunner.store.DefinitionsFile.Contents;
import qarunner.store.DefinitionsFile.InvalidDefinitionsException;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefinitionsFile} using the fixtures under
 * {@code src/test/resources/definitions}.
 */
public class DefinitionsFileTest {

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(DefinitionsFileTest.class.getResource("/definitions/" + name).toURI());
    }

    @Test(description = "valid document is parsed into all four sections")
    public void read_validDocument() throws Exception {
        Contents c = DefinitionsFile.read(fixture("valid.json"));

        assertThat(c.plans).singleElement().satisfies(p -> {
            assertThat(p.getId()).isEqualTo("checkout");
            assertThat(p.getMembers()).extracting(m -> m.getTestType())
                    .containsExactly(TestType.UI, TestType.API);
        });
        assertThat(c.uiTests.get(0).getSteps()).hasSize(3);
        assertThat(c.uiTests.get(0).findElement("submit")).isPresent();
        assertThat(c.apiTests.get(0).getAssertions()).extracting(ApiCheck::getType)
                .containsExactly(ApiCheck.Type.STATUS_CODE, ApiCheck.Type.BODY_CONTAINS);

        Schedule s = c.schedules.get(0);
        assertThat(s.getNextRunAt()).isEqualTo(Instant.parse("2024-06-01T02:30:00Z"));
        assertThat(s.getRetryPolicy()).isEqualTo(RetryPolicy.RETRY_N);
        assertThat(s.getRetryCount()).isEqualTo(2);
        assertThat(s.isActive()).as("active defaults to true").isTrue();
        assertThat(s.toOverrides().engine()).isEqualTo(BrowserEngine.FIREFOX);
    }

    @Test(description = "schema violations are reported together")
    public void read_invalidDocument_listsViolations() {
        assertThatThrownBy(() -> DefinitionsFile.read(fixture("invalid.json")))
                .isInstanceOf(InvalidDefinitionsException.class)
                .hasMessageContaining("invalid.json")
                .hasMessageContaining("nextRunAt")
                .hasMessageContaining("testType");
    }

    @Test(description = "text that is not JSON is an IOException")
    public void parse_notJson() {
        assertThatThrownBy(() -> DefinitionsFile.parse("{ plans: ", "inline"))
                .isInstanceOf(IOException.class);
    }

    @Test(description = "missing sections become empty lists")
    public void parse_emptyObject() throws Exception {
        Contents c = DefinitionsFile.parse("{}", "inline");

        assertThat(c.plans).isEmpty();
        assertThat(c.schedules).isEmpty();
    }

    @Test(description = "loadInto fills both stores")
    public void loadInto_populatesStores() throws Exception {
        InMemoryDefinitionStore defs = new InMemoryDefinitionStore();
        InMemoryScheduleStore schedules = new InMemoryScheduleStore();

        DefinitionsFile.loadInto(DefinitionsFile.read(fixture("valid.json")), defs, schedules);

        assertThat(defs.findPlan("checkout")).isPresent();
        assertThat(defs.findUiTest("login")).isPresent();
        assertThat(defs.findApiTest("health")).isPresent();
        assertThat(schedules.findActive()).extracting(Schedule::getId).containsExactly("nightly");
    }
}
