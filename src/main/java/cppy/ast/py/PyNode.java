package cppy.ast.py;

public sealed interface PyNode permits PyModule, PyStmt, PyExpr {
}
