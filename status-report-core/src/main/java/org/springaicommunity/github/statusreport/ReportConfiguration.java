package org.springaicommunity.github.statusreport;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.OptBoolean;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration of a status report run.
 *
 * <p>
 * Instances are normally produced by {@link ReportConfigurationLoader}, which starts from
 * the bundled {@code default.yml} and overlays the user's files. YAML keys are the
 * snake_case form of the property names ({@code project_number}, {@code match_on}, ...).
 *
 * <p>
 * Default values are provided for everything except the GitHub owner, project number and
 * team, which have to be configured.
 */
public class ReportConfiguration {

	/**
	 * The GitHub GraphQL endpoint.
	 */
	private String url = "https://api.github.com/graphql";

	/**
	 * The organization login that owns the project board.
	 */
	private String owner = "";

	/**
	 * The project board number within the organization.
	 */
	private int projectNumber = 0;

	/**
	 * The team name printed under the report title.
	 */
	private String team = "";

	/**
	 * Directory receiving the generated report files.
	 */
	private String outputDirectory = ".";

	/**
	 * GitHub token used for fetching and archiving.
	 */
	private String token = "";

	private Tuning tuning = new Tuning();

	private ReportWindow reportWindow = new ReportWindow();

	private LabelSection labelSection = new LabelSection();

	private Summary summary = new Summary();

	private Unclassified unclassified = new Unclassified();

	/**
	 * User sections in matching order. Later configuration files replace the list.
	 */
	@JsonMerge(OptBoolean.FALSE)
	private List<SectionDefinition> sections = new ArrayList<>();

	public String getUrl() {
		return url;
	}

	public void setUrl(String url) {
		this.url = url;
	}

	public String getOwner() {
		return owner;
	}

	public void setOwner(String owner) {
		this.owner = owner;
	}

	public int getProjectNumber() {
		return projectNumber;
	}

	public void setProjectNumber(int projectNumber) {
		this.projectNumber = projectNumber;
	}

	public String getTeam() {
		return team;
	}

	public void setTeam(String team) {
		this.team = team;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public String getToken() {
		return token;
	}

	public void setToken(String token) {
		this.token = token;
	}

	public Tuning getTuning() {
		return tuning;
	}

	public void setTuning(Tuning tuning) {
		this.tuning = tuning;
	}

	public ReportWindow getReportWindow() {
		return reportWindow;
	}

	public void setReportWindow(ReportWindow reportWindow) {
		this.reportWindow = reportWindow;
	}

	public LabelSection getLabelSection() {
		return labelSection;
	}

	public void setLabelSection(LabelSection labelSection) {
		this.labelSection = labelSection;
	}

	public Summary getSummary() {
		return summary;
	}

	public void setSummary(Summary summary) {
		this.summary = summary;
	}

	public Unclassified getUnclassified() {
		return unclassified;
	}

	public void setUnclassified(Unclassified unclassified) {
		this.unclassified = unclassified;
	}

	public List<SectionDefinition> getSections() {
		return sections;
	}

	public void setSections(List<SectionDefinition> sections) {
		this.sections = sections;
	}

	/**
	 * Query sizes used when paging through the project. Items are paged; labels and field
	 * values per item are not, so those limits must cover the largest item.
	 */
	public static class Tuning {

		private int issueCount = 100;

		private int labelCount = 20;

		private int fieldValueCount = 20;

		public int getIssueCount() {
			return issueCount;
		}

		public void setIssueCount(int issueCount) {
			this.issueCount = issueCount;
		}

		public int getLabelCount() {
			return labelCount;
		}

		public void setLabelCount(int labelCount) {
			this.labelCount = labelCount;
		}

		public int getFieldValueCount() {
			return fieldValueCount;
		}

		public void setFieldValueCount(int fieldValueCount) {
			this.fieldValueCount = fieldValueCount;
		}

	}

	/**
	 * Placement of the weekly windows.
	 */
	public static class ReportWindow {

		/**
		 * Weekday on which every report starts (and the previous one ends).
		 */
		private String startOnWeekday = "sunday";

		public String getStartOnWeekday() {
			return startOnWeekday;
		}

		public void setStartOnWeekday(String startOnWeekday) {
			this.startOnWeekday = startOnWeekday;
		}

		/**
		 * The configured weekday.
		 * @return the anchor weekday
		 * @throws IllegalArgumentException if the name is not a weekday
		 */
		@JsonIgnore
		public DayOfWeek anchorDay() {
			return DayOfWeek.valueOf(startOnWeekday.trim().toUpperCase(Locale.ROOT));
		}

	}

	/**
	 * The "By Label" summary listing label counts.
	 */
	public static class LabelSection {

		private boolean enabled = false;

		private int renderOrder = 100;

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public int getRenderOrder() {
			return renderOrder;
		}

		public void setRenderOrder(int renderOrder) {
			this.renderOrder = renderOrder;
		}

	}

	/**
	 * A free text section repeated in every report.
	 */
	public static class Summary {

		private boolean enabled = false;

		private String name = "Summary";

		private String body = "";

		private int renderOrder = 0;

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public String getBody() {
			return body;
		}

		public void setBody(String body) {
			this.body = body;
		}

		public int getRenderOrder() {
			return renderOrder;
		}

		public void setRenderOrder(int renderOrder) {
			this.renderOrder = renderOrder;
		}

	}

	/**
	 * The section collecting items that no user section matched.
	 */
	public static class Unclassified {

		private String name = "Unclassified Items";

		private int renderOrder = 1000;

		private boolean omitIfEmpty = true;

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public int getRenderOrder() {
			return renderOrder;
		}

		public void setRenderOrder(int renderOrder) {
			this.renderOrder = renderOrder;
		}

		public boolean isOmitIfEmpty() {
			return omitIfEmpty;
		}

		public void setOmitIfEmpty(boolean omitIfEmpty) {
			this.omitIfEmpty = omitIfEmpty;
		}

		/**
		 * The section definition used by the classifier.
		 * @return a catch-all section definition
		 */
		public SectionDefinition toDefinition() {
			return SectionDefinition.catchAll(name, renderOrder, omitIfEmpty);
		}

	}

}
