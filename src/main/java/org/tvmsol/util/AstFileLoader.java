package org.tvmsol.util;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.tvmsol.ast.SourceUnit;
import org.tvmsol.dto.SourceUnitDTO;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one annotated AST exported by the front end as JSON.
 */
public class AstFileLoader
{
	private static final Gson GSON = new Gson();

	private final Path filePath;
	private SourceUnitDTO data;

	public AstFileLoader(Path filePath)
	{
		this.filePath = filePath;
	}

	public void load() throws IOException
	{
		try (Reader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8))
		{
			this.data = GSON.fromJson(reader, SourceUnitDTO.class);
		}
		catch (JsonParseException e)
		{
			throw new IllegalArgumentException("Malformed AST file " + filePath + ": " + e.getMessage(), e);
		}

		if (data == null)
		{
			throw new IllegalArgumentException("AST file is empty: " + filePath);
		}
		if (data.path == null)
		{
			data.path = filePath.getFileName().toString();
			Debug.logWarning("AST file " + filePath + " has no source path, using '" + data.path + "'.");
		}
		Debug.logDebug("Loaded AST of " + data.path + " (" + data.contracts.size() + " contract(s))");
	}

	public SourceUnitDTO getData()
	{
		return this.data;
	}

	/**
	 * Loads every file and links them together, so that bases and overrides may cross files.
	 */
	public static List<SourceUnit> loadAll(List<Path> files) throws IOException
	{
		List<SourceUnitDTO> dtos = new ArrayList<>();
		for (Path file : files)
		{
			AstFileLoader loader = new AstFileLoader(file);
			loader.load();
			dtos.add(loader.getData());
		}
		return new AstDTOConverter().convert(dtos);
	}
}
