package edu.upf.taln.phrasegraph.core.io;

import com.google.common.base.Splitter;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.TokenData;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Reads documents from the 10-column CoNLL-U format.
 * Documents are split at "# newdoc" comments, sentences at blank lines. Multi-word token ranges and empty nodes
 * are skipped. The MISC column may carry SpaceAfter=No, Ent=TYPE and Coref=i,j with document-level token indices.
 */
public class CoNLLUReader implements DocumentReader
{
	private static final int num_columns = 10;
	private static final Splitter bar_splitter = Splitter.on('|').omitEmptyStrings().trimResults();
	private static final Splitter comma_splitter = Splitter.on(',').omitEmptyStrings().trimResults();
	private final static Logger log = LogManager.getLogger();

	public List<Document> read(Path path) throws IOException
	{
		log.info("Reading " + path);
		return read(FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8));
	}

	@Override
	public List<Document> read(String contents)
	{
		final List<Document> docs = new ArrayList<>();
		String id = null;
		List<TokenData> tokens = new ArrayList<>();
		List<Pair<Integer, Integer>> sentences = new ArrayList<>();
		int start = 0;

		final List<String> lines = new ArrayList<>(Arrays.asList(contents.split("\\r?\\n", -1)));
		lines.add(""); // closes the last sentence
		for (int n = 0; n < lines.size(); ++n)
		{
			final String line = lines.get(n).trim();
			if (line.startsWith("#"))
			{
				if (line.startsWith("# newdoc"))
				{
					if (!tokens.isEmpty())
						docs.add(new Document(id, tokens, sentences));
					id = StringUtils.trimToNull(StringUtils.substringAfter(line, "="));
					tokens = new ArrayList<>();
					sentences = new ArrayList<>();
					start = 0;
				}
				continue;
			}
			if (line.isEmpty())
			{
				if (tokens.size() > start)
				{
					sentences.add(Pair.of(start, tokens.size()));
					start = tokens.size();
				}
				continue;
			}

			final String[] columns = line.split("\t");
			if (columns.length != num_columns)
				throw new IllegalArgumentException("Line " + (n + 1) + " has " + columns.length + " columns instead of " +
						num_columns + ": " + line);
			if (columns[0].contains("-") || columns[0].contains("."))
				continue;

			try
			{
				tokens.add(parseToken(columns, start));
			}
			catch (NumberFormatException e)
			{
				throw new IllegalArgumentException("Invalid number in line " + (n + 1) + ": " + line, e);
			}
		}

		if (!tokens.isEmpty())
			docs.add(new Document(id, tokens, sentences));
		log.debug("Read " + docs.size() + " documents");
		return docs;
	}

	private static TokenData parseToken(String[] columns, int offset)
	{
		final int id = Integer.parseInt(columns[0]);
		final int head = Integer.parseInt(columns[6]);
		final int index = offset + id - 1;

		final String upos = columns[3];
		final String xpos = value(columns[4]);
		final POS.Tag pos = upos.equals("_") && xpos != null ?
				POS.get(xpos, POS.Tagset.EnglishPTB) : POS.get(upos, POS.Tagset.UD);

		final Map<String, List<String>> morph = new LinkedHashMap<>();
		for (String feat : bar_splitter.split(columns[5].equals("_") ? "" : columns[5]))
		{
			final String name = StringUtils.substringBefore(feat, "=");
			morph.put(name, comma_splitter.splitToList(StringUtils.substringAfter(feat, "=")));
		}

		String whitespace = " ";
		String ent = null;
		List<Integer> corefs = null;
		for (String misc : bar_splitter.split(columns[9].equals("_") ? "" : columns[9]))
		{
			final String name = StringUtils.substringBefore(misc, "=");
			final String value = StringUtils.substringAfter(misc, "=");
			switch (name)
			{
				case "SpaceAfter":
					if (value.equals("No"))
						whitespace = "";
					break;
				case "Ent":
					ent = value;
					break;
				case "Coref":
					corefs = comma_splitter.splitToStream(value).map(Integer::parseInt).collect(Collectors.toList());
					break;
				default:
					break;
			}
		}

		return new TokenData(columns[1], whitespace, value(columns[2]), pos, xpos, value(columns[7]),
				head == 0 ? index : offset + head - 1, morph, ent, corefs);
	}

	private static String value(String column)
	{
		return column.equals("_") ? null : column;
	}
}
