package org.tvmsol.dto;

import java.util.ArrayList;
import java.util.List;

public class DiagnosticReportDTO
{
	public String tvmVersion;
	public int errorCount;
	public List<DiagnosticDTO> diagnostics = new ArrayList<>();

	public static class DiagnosticDTO
	{
		public String kind;
		public int errorId;
		public String location;
		public String message;
		public List<SecondaryDTO> secondary = new ArrayList<>();
	}

	public static class SecondaryDTO
	{
		public String label;
		public String location;
	}
}
