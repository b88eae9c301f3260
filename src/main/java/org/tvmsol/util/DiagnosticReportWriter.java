package org.tvmsol.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.tvmsol.diagnostic.Diagnostic;
import org.tvmsol.diagnostic.SecondaryLocation;
import org.tvmsol.dto.DiagnosticReportDTO;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

public class DiagnosticReportWriter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	public static DiagnosticReportDTO toReport(List<Diagnostic> diagnostics, TvmVersion tvmVersion)
	{
		DiagnosticReportDTO report = new DiagnosticReportDTO();
		report.tvmVersion = tvmVersion.getOptionName();
		report.errorCount = diagnostics.size();
		for (Diagnostic diagnostic : diagnostics)
		{
			DiagnosticReportDTO.DiagnosticDTO dto = new DiagnosticReportDTO.DiagnosticDTO();
			dto.kind = diagnostic.kind().name();
			dto.errorId = diagnostic.kind().getErrorId();
			dto.location = diagnostic.primaryLocation().toString();
			dto.message = diagnostic.message();
			for (SecondaryLocation secondary : diagnostic.secondaryLocations())
			{
				DiagnosticReportDTO.SecondaryDTO sd = new DiagnosticReportDTO.SecondaryDTO();
				sd.label = secondary.label().strip();
				sd.location = secondary.location().toString();
				dto.secondary.add(sd);
			}
			report.diagnostics.add(dto);
		}
		return report;
	}

	public static String toJson(List<Diagnostic> diagnostics, TvmVersion tvmVersion)
	{
		return GSON.toJson(toReport(diagnostics, tvmVersion));
	}

	public static void write(List<Diagnostic> diagnostics, TvmVersion tvmVersion, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(diagnostics, tvmVersion), StandardCharsets.UTF_8,
				StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote diagnostics report to: " + outPath);
	}
}
