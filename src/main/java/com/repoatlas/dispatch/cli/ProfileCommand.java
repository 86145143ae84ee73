package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.profile.Profile;
import com.repoatlas.core.profile.ProfileResult;
import com.repoatlas.core.profile.ProfileSummarizer;
import com.repoatlas.core.profile.ProfileWriter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: atlas profile
 * <p>
 * Writes a budgeted markdown summary of the project, plus module maps for the largest
 * top-level directories. Skips the write when the profile is newer than every source file.
 */
@Command(name = "profile", mixinStandardHelpOptions = true, description = "Generate the budgeted project profile")
@Component
public class ProfileCommand extends AtlasSubcommand {

    private final ProjectAnalyzer analyzer;
    private final ProfileSummarizer summarizer;
    private final ProfileWriter writer;

    @Option(names = {"-b", "--budget"}, description = "Character budget for the main profile")
    Integer budget;

    @Option(names = {"-f", "--force"}, description = "Regenerate even when the profile is up to date")
    boolean force;

    @Option(names = "--dry-run", description = "Print the profile without writing it")
    boolean dryRun;

    public ProfileCommand(ProjectAnalyzer analyzer, ProfileSummarizer summarizer, ProfileWriter writer) {
        this.analyzer = analyzer;
        this.summarizer = summarizer;
        this.writer = writer;
    }

    @Override
    protected String commandName() {
        return "profile";
    }

    @Override
    protected int execute() {
        if (budget != null && budget < 1) {
            ConsoleOutput.failure(common.json, "--budget must be positive, got " + budget);
            return ExitCodes.INPUT_ERROR;
        }
        AnalysisResult analysis = analyzer.analyze(common.root(), common.includeTests);
        ProfileResult result = budget != null ? summarizer.summarize(analysis, budget) : summarizer.summarize(analysis);

        String status = "dry_run";
        if (!dryRun) {
            status = writer.write(common.root(), result, analysis.newestChange(), force) == ProfileWriter.Outcome.WRITTEN
                    ? "written" : "up_to_date";
        }

        if (common.json) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("status", status);
            json.put("path", writer.profilePath(common.root()).toString());
            json.put("chars", result.main().chars());
            json.put("budget", result.main().budget());
            json.put("omitted", result.main().omitted());
            json.put("module_maps", result.moduleMaps().stream().map(Profile::name).toList());
            json.put("profile", result.main().render());
            ConsoleOutput.json(json);
            return ExitCodes.OK;
        }

        ConsoleOutput.line(result.main().render());
        switch (status) {
            case "written" -> ConsoleOutput.success("Profile written to " + writer.profilePath(common.root())
                    + " (" + result.main().chars() + "/" + result.main().budget() + " chars, "
                    + result.moduleMaps().size() + " module map(s))");
            case "up_to_date" -> ConsoleOutput.info("Profile is up to date; use --force to regenerate");
            default -> ConsoleOutput.info("Dry run: nothing written");
        }
        return ExitCodes.OK;
    }
}
