package org.javai.cellsim.datamodel.internal.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.javai.cellsim.datamodel.MalformedFieldException;
import org.javai.cellsim.datamodel.engine.ConstructionCommand;
import org.javai.cellsim.datamodel.internal.parse.DataModelNode;
import org.javai.cellsim.datamodel.internal.parse.ObjectExpression;
import org.javai.cellsim.datamodel.internal.parse.ObjectExpressionParser;
import org.javai.cellsim.datamodel.model.MeshObject;
import org.javai.cellsim.datamodel.model.Orientation;
import org.javai.cellsim.datamodel.model.Region;
import org.javai.cellsim.datamodel.model.ReleaseSite;
import org.javai.cellsim.datamodel.model.Species;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds release sites targeting a whole mesh object or one of its regions.
 */
public class ReleaseSiteBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ReleaseSiteBuilder.class);

	public List<ReleaseSite> build(DataModelNode document, BuildContext context) {
		List<ReleaseSite> sites = new ArrayList<>();
		for (DataModelNode entry : document.listAt(context.layout().releaseSites())) {
			String name = entry.requireString("name");
			String exprPath = entry.pathOf("object_expr");
			ObjectExpression target = ObjectExpressionParser.parse(entry.requireString("object_expr"), exprPath);

			MeshObject object = context.meshObjects().require(target.objectName(), exprPath);
			Region region = target.region()
					.map(regionName -> context.requireRegion(object, regionName, exprPath))
					.orElse(null);
			Species species = context.species().require(entry.requireString("molecule"), entry.pathOf("molecule"));
			int quantity = entry.requireInt("quantity");
			if (quantity <= 0) {
				throw new MalformedFieldException(entry.path(), "quantity", "must be positive: " + quantity);
			}
			boolean oriented = orientFlag(entry);

			ReleaseSite site = new ReleaseSite(name, object, region, species, quantity, oriented);
			sites.add(site);
			context.plan().add(new ConstructionCommand.ReleaseMolecules(site));
			logger.debug("Release site '{}': {} x {} into {}", name, quantity, species.name(), target);
		}
		return sites;
	}

	/**
	 * The orientation flag is a boolean in the flat layout and an orientation symbol in CellBlender
	 * exports, where {@code '} and {@code ,} mean the orientation is applied and {@code ;} or an
	 * empty string mean it is not.
	 */
	static boolean orientFlag(DataModelNode entry) {
		Object raw = entry.raw("orient");
		if (raw == null) {
			return false;
		}
		if (raw instanceof Boolean b) {
			return b;
		}
		if (raw instanceof String s) {
			String text = s.trim();
			if (text.isEmpty() || text.equals(String.valueOf(Orientation.MIX.symbol()))) {
				return false;
			}
			if (text.equals(String.valueOf(Orientation.UP.symbol()))
					|| text.equals(String.valueOf(Orientation.DOWN.symbol()))) {
				return true;
			}
			String lower = text.toLowerCase(Locale.ROOT);
			if (lower.equals("true") || lower.equals("false")) {
				return Boolean.parseBoolean(lower);
			}
		}
		throw new MalformedFieldException(entry.path(), "orient", "is not an orientation flag: '" + raw + "'");
	}
}
