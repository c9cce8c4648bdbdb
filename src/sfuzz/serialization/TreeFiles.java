package sfuzz.serialization;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import sfuzz.model.wgsl.WgslNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Reads and writes tree files, which wrap a single encoded node together with a format version.
 */
public class TreeFiles {
	public static final int FORMAT_VERSION = 1;

	private static final Logger logger = Logger.getLogger("sfuzz.serialization");

	private TreeFiles() {}

	public static JSONObject toJson(WgslNode root) {
		JSONObject result = new JSONObject();
		result.put("format", FORMAT_VERSION);
		result.put("root", WgslJsonEncoder.encode(root));
		return result;
	}

	public static WgslNode fromJson(String contents) {
		JSONObject json;
		try {
			json = new JSONObject(contents);
		} catch (JSONException e) {
			throw new MalformedTreeException("parsing error: " + e.getMessage(), e);
		}
		int format;
		try {
			format = json.getInt("format");
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
		if (format != FORMAT_VERSION) {
			throw new MalformedTreeException("unsupported tree format version " + format);
		}
		try {
			return WgslJsonDecoder.decodeNode(json.getJSONObject("root"));
		} catch (JSONException e) {
			throw new MalformedTreeException(e.getMessage(), e);
		}
	}

	public static WgslNode read(Path path) throws IOException {
		logger.fine("Reading tree from \"" + path + "\"");
		return fromJson(FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8));
	}

	public static void write(Path path, WgslNode root) throws IOException {
		FileUtils.writeStringToFile(path.toFile(), toJson(root).toString(2), StandardCharsets.UTF_8);
		logger.info("Wrote file \"" + path + "\"");
	}
}
