package qarunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Reference from a plan to one UI or API test. */
public class PlanMember {

    @JsonProperty("testType")
    private TestType testType;

    @JsonProperty("testId")
    private String testId;

    public PlanMember() {}

    public PlanMember(TestType testType, String testId) {
        this.testType = testType;
        this.testId   = testId;
    }

    public static PlanMember ui(String testId)  { return new PlanMember(TestType.UI, testId); }
    public static PlanMember api(String testId) { return new PlanMember(TestType.API, testId); }

    public TestType getTestType() { return testType; }
    public String getTestId()     { return testId; }

    public void setTestType(TestType testType) { this.testType = testType; }
    public void setTestId(String testId)       { this.testId = testId; }

    @Override
    public String toString() {
        return testType + ":" + testId;
    }
}
